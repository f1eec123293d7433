package com.demoBank.chatbox.llm;

import com.demoBank.chatbox.llm.dto.ChatCompletionChunk;
import com.demoBank.chatbox.llm.dto.ChatCompletionRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.util.function.Consumer;

/**
 * Streams chat completions from an OpenAI-compatible endpoint (Groq, OpenAI).
 * 
 * Each {@code data:} event carries one {@link ChatCompletionChunk}, and {@code data: [DONE]} ends the stream.
 */
@Slf4j
public class OpenAiLlmProvider extends StreamingLlmProvider {
    
    private static final String DONE_MARKER = "[DONE]";
    
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final Double temperature;
    private final Integer maxCompletionTokens;
    
    /**
     * @param apiUrl Full chat completions URL
     */
    public OpenAiLlmProvider(String name, RestClient.Builder restClientBuilder, ObjectMapper objectMapper,
                             String apiUrl, String apiKey, Double temperature, Integer maxCompletionTokens) {
        super(name, restClientBuilder, apiKey);
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.temperature = temperature;
        this.maxCompletionTokens = maxCompletionTokens;
    }
    
    @Override
    public LlmResponse stream(LlmRequest request, Consumer<String> onChunk, LlmCancellation cancellation) {
        String apiKey = requireApiKey();
        
        ChatCompletionRequest body = ChatCompletionRequest.builder()
                .messages(request.getTurns().stream()
                        .map(turn -> ChatCompletionRequest.Message.builder()
                                .role(turn.getRole())
                                .content(turn.getContent())
                                .build())
                        .toList())
                .model(request.getModel())
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .topP(1.0)
                .stream(true)
                .build();
        
        log.debug("Calling chat completions API - provider: {}, model: {}, turns: {}", 
                getName(), request.getModel(), request.getTurns().size());
        
        return postStream(apiUrl, headers -> headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey), body,
                cancellation, stream -> {
                    ReplyBuilder reply = new ReplyBuilder(request.getModel(), onChunk, cancellation);
                    readEvents(stream, cancellation, (event, data) -> {
                        if (DONE_MARKER.equals(data)) {
                            return false;
                        }
                        ChatCompletionChunk chunk = parseChunk(data);
                        reply.model(chunk.getModel());
                        ChatCompletionChunk.Usage usage = chunk.resolveUsage();
                        if (usage != null && usage.getTotalTokens() != null) {
                            reply.totalTokens(usage.getTotalTokens());
                        }
                        reply.append(chunk.deltaContent());
                        return true;
                    });
                    return reply.build();
                });
    }
    
    private ChatCompletionChunk parseChunk(String data) {
        try {
            return objectMapper.readValue(data, ChatCompletionChunk.class);
        } catch (JsonProcessingException e) {
            throw new LlmException("Malformed stream chunk from " + getName() + " API", e);
        }
    }
}
