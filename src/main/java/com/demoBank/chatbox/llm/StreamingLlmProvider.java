package com.demoBank.chatbox.llm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Base for providers that answer with a server-sent event stream over HTTP.
 * 
 * Responsibilities:
 * - POST the request and hand the open body to the concrete provider
 * - Split the body into {@code event:} / {@code data:} pairs
 * - Register the response for cancellation and turn failures into {@link LlmException}
 */
@Slf4j
public abstract class StreamingLlmProvider implements LlmProvider {
    
    private static final String DATA_PREFIX = "data:";
    private static final String EVENT_PREFIX = "event:";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    
    private final String name;
    private final RestClient restClient;
    private final String apiKey;
    
    protected StreamingLlmProvider(String name, RestClient.Builder restClientBuilder, String apiKey) {
        this.name = name;
        this.restClient = restClientBuilder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.apiKey = apiKey;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("LLM API key is not configured. Calls will fail until it is set - provider: {}", name);
        }
    }
    
    @Override
    public String getName() {
        return name;
    }
    
    /**
     * Request factory for the production clients. The JDK client aborts a blocked body read when the
     * response is closed from another thread.
     */
    public static JdkClientHttpRequestFactory requestFactory(Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
    
    protected String requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new LlmException(name + " API key is not configured");
        }
        return apiKey;
    }
    
    /**
     * Posts the body and reads the event stream with the given reader.
     */
    protected LlmResponse postStream(String uri, Consumer<HttpHeaders> headers, Object body,
                                     LlmCancellation cancellation, StreamReader reader) {
        try {
            LlmResponse response = restClient.post()
                    .uri(uri)
                    .headers(headers)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .body(body)
                    .exchange((httpRequest, httpResponse) -> {
                        cancellation.register(httpResponse);
                        if (httpResponse.getStatusCode().isError()) {
                            throw new LlmException(name + " API returned status " + httpResponse.getStatusCode().value());
                        }
                        return reader.read(httpResponse.getBody());
                    });
            if (response == null) {
                throw new LlmException(name + " API returned no response");
            }
            log.debug("LLM response received - provider: {}, model: {}, tokens used: {}",
                    name, response.getModel(), response.getTotalTokens());
            return response;
        } catch (RestClientException e) {
            if (cancellation.isCancelled()) {
                throw new LlmException("LLM call cancelled - provider: " + name, e);
            }
            throw new LlmException("Failed to call " + name + " API: " + e.getMessage(), e);
        }
    }
    
    /**
     * Feeds every data line to the handler until it returns false or the stream ends.
     * Stops with an {@link LlmException} once the call is cancelled.
     */
    protected void readEvents(InputStream body, LlmCancellation cancellation, EventHandler handler) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            String event = null;
            String line;
            while ((line = reader.readLine()) != null) {
                if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                    throw new LlmException("LLM call cancelled - provider: " + name);
                }
                if (line.isEmpty()) {
                    event = null;
                    continue;
                }
                if (line.startsWith(EVENT_PREFIX)) {
                    event = line.substring(EVENT_PREFIX.length()).trim();
                    continue;
                }
                if (!line.startsWith(DATA_PREFIX)) {
                    continue;
                }
                String data = line.substring(DATA_PREFIX.length()).trim();
                if (data.isEmpty()) {
                    continue;
                }
                if (!handler.onEvent(event, data)) {
                    return;
                }
            }
        }
        if (cancellation.isCancelled()) {
            throw new LlmException("LLM call cancelled - provider: " + name);
        }
    }
    
    @FunctionalInterface
    protected interface StreamReader {
        LlmResponse read(InputStream body) throws IOException;
    }
    
    @FunctionalInterface
    protected interface EventHandler {
        /**
         * @param event Value of the preceding {@code event:} line, or null
         * @param data Payload of the {@code data:} line
         * @return false to stop reading
         */
        boolean onEvent(String event, String data);
    }
    
    /**
     * Accumulates a streamed reply. Chunks stop reaching the caller once the call is cancelled.
     */
    protected static class ReplyBuilder {
        
        private final StringBuilder content = new StringBuilder();
        private final Consumer<String> onChunk;
        private final LlmCancellation cancellation;
        private String model;
        private long totalTokens;
        
        protected ReplyBuilder(String model, Consumer<String> onChunk, LlmCancellation cancellation) {
            this.model = model;
            this.onChunk = onChunk;
            this.cancellation = cancellation;
        }
        
        protected void append(String delta) {
            if (delta == null || delta.isEmpty() || cancellation.isCancelled()) {
                return;
            }
            content.append(delta);
            onChunk.accept(delta);
        }
        
        protected void model(String reportedModel) {
            if (reportedModel != null && !reportedModel.isBlank()) {
                this.model = reportedModel;
            }
        }
        
        protected void totalTokens(long tokens) {
            this.totalTokens = tokens;
        }
        
        protected LlmResponse build() {
            return LlmResponse.builder()
                    .content(content.toString())
                    .model(model)
                    .totalTokens(totalTokens)
                    .build();
        }
    }
}
