package com.demoBank.chatbox.llm;

import com.demoBank.chatbox.llm.dto.AnthropicMessagesRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.util.function.Consumer;

/**
 * Streams replies from the Anthropic Messages API.
 * 
 * Text arrives in {@code content_block_delta} events and {@code message_stop} ends the stream.
 * Input tokens are reported on {@code message_start}, output tokens on {@code message_delta}.
 */
@Slf4j
public class AnthropicLlmProvider extends StreamingLlmProvider {
    
    static final String API_VERSION = "2023-06-01";
    static final int MAX_TOKENS = 4096;
    
    private final ObjectMapper objectMapper;
    private final String messagesUrl;
    
    /**
     * @param endpoint API base, e.g. {@code https://api.anthropic.com/v1}
     */
    public AnthropicLlmProvider(RestClient.Builder restClientBuilder, ObjectMapper objectMapper,
                                String endpoint, String apiKey) {
        super("anthropic", restClientBuilder, apiKey);
        this.objectMapper = objectMapper;
        this.messagesUrl = endpoint + "/messages";
    }
    
    @Override
    public LlmResponse stream(LlmRequest request, Consumer<String> onChunk, LlmCancellation cancellation) {
        String apiKey = requireApiKey();
        
        // the Messages API has no system role inside the conversation
        AnthropicMessagesRequest body = AnthropicMessagesRequest.builder()
                .model(request.getModel())
                .messages(request.getTurns().stream()
                        .map(turn -> AnthropicMessagesRequest.Message.builder()
                                .role("system".equals(turn.getRole()) ? "user" : turn.getRole())
                                .content(turn.getContent())
                                .build())
                        .toList())
                .maxTokens(MAX_TOKENS)
                .stream(true)
                .build();
        
        log.debug("Calling Anthropic API - model: {}, turns: {}", request.getModel(), request.getTurns().size());
        
        return postStream(messagesUrl, headers -> {
            headers.set("x-api-key", apiKey);
            headers.set("anthropic-version", API_VERSION);
        }, body, cancellation, stream -> {
            ReplyBuilder reply = new ReplyBuilder(request.getModel(), onChunk, cancellation);
            long[] tokens = new long[2];
            readEvents(stream, cancellation, (event, data) -> {
                JsonNode node = parse(data);
                switch (node.path("type").asText()) {
                    case "message_start" -> {
                        reply.model(node.path("message").path("model").asText(null));
                        tokens[0] = node.path("message").path("usage").path("input_tokens").asLong();
                    }
                    case "content_block_delta" -> reply.append(node.path("delta").path("text").asText(null));
                    case "message_delta" -> tokens[1] = node.path("usage").path("output_tokens").asLong(tokens[1]);
                    case "message_stop" -> {
                        return false;
                    }
                    case "error" -> throw new LlmException("Anthropic stream error: "
                            + node.path("error").path("message").asText("unknown"));
                    default -> {
                        // ping, content_block_start, content_block_stop
                    }
                }
                return true;
            });
            reply.totalTokens(tokens[0] + tokens[1]);
            return reply.build();
        });
    }
    
    private JsonNode parse(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new LlmException("Malformed stream event from Anthropic API", e);
        }
    }
}
