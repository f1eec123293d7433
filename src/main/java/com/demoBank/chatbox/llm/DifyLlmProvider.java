package com.demoBank.chatbox.llm;

import com.demoBank.chatbox.llm.dto.DifyChatRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Streams replies from a Dify chat application.
 * 
 * Dify takes a single query string, so the conversation is flattened to {@code role: content} lines.
 * {@code message} events carry the answer text; {@code message_end} carries usage and ends the stream.
 */
@Slf4j
public class DifyLlmProvider extends StreamingLlmProvider {
    
    private static final String RESPONSE_MODE = "streaming";
    
    private final ObjectMapper objectMapper;
    private final String chatUrl;
    
    /**
     * @param endpoint API base, e.g. {@code https://api.dify.ai/v1}
     */
    public DifyLlmProvider(RestClient.Builder restClientBuilder, ObjectMapper objectMapper,
                           String endpoint, String apiKey) {
        super("dify", restClientBuilder, apiKey);
        this.objectMapper = objectMapper;
        this.chatUrl = endpoint + "/chat-messages";
    }
    
    @Override
    public LlmResponse stream(LlmRequest request, Consumer<String> onChunk, LlmCancellation cancellation) {
        String apiKey = requireApiKey();
        
        DifyChatRequest body = DifyChatRequest.builder()
                .inputs(Map.of())
                .query(formatQuery(request))
                .responseMode(RESPONSE_MODE)
                .user("chatbox")
                .build();
        
        log.debug("Calling Dify API - model: {}, turns: {}", request.getModel(), request.getTurns().size());
        
        return postStream(chatUrl, headers -> headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey), body,
                cancellation, stream -> {
                    ReplyBuilder reply = new ReplyBuilder(request.getModel(), onChunk, cancellation);
                    readEvents(stream, cancellation, (event, data) -> {
                        JsonNode node = parse(data);
                        switch (node.path("event").asText()) {
                            case "message", "agent_message" -> reply.append(node.path("answer").asText(null));
                            case "message_end" -> {
                                reply.totalTokens(node.path("metadata").path("usage").path("total_tokens").asLong());
                                return false;
                            }
                            case "error" -> throw new LlmException("Dify stream error: "
                                    + node.path("message").asText("unknown"));
                            default -> {
                                // workflow and ping events carry no answer text
                            }
                        }
                        return true;
                    });
                    return reply.build();
                });
    }
    
    static String formatQuery(LlmRequest request) {
        return request.getTurns().stream()
                .map(turn -> turn.getRole() + ": " + turn.getContent())
                .collect(Collectors.joining("\n"));
    }
    
    private JsonNode parse(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new LlmException("Malformed stream event from Dify API", e);
        }
    }
}
