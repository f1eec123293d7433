package com.demoBank.chatbox.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the {@code chatbox.*} settings in application.yaml.
 * Defaults here match the production values; the yaml only overrides what differs per environment.
 */
@Configuration
@ConfigurationProperties(prefix = "chatbox")
@Data
@Validated
public class ChatboxProperties {
    
    @NotBlank
    private String pathPrefix = "/chatbox";
    
    /**
     * Allowed WebSocket origins. Empty means every origin is accepted (logged at startup).
     */
    private List<String> allowedOrigins = new ArrayList<>();
    
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(10);
    
    @Valid
    private WebSocket websocket = new WebSocket();
    @Valid
    private Session session = new Session();
    @Valid
    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Llm llm = new Llm();
    @Valid
    private Notification notification = new Notification();
    @Valid
    private Jwt jwt = new Jwt();
    @Valid
    private Storage storage = new Storage();
    
    @Data
    public static class WebSocket {
        @NotBlank
        private String path = "/ws";
        @Positive
        private int maxMessageSize = 1024 * 1024;
        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration idleTimeout = Duration.ofSeconds(60);
        @Positive
        private int maxConnectionsPerUser = 10;
        @Positive
        private int outboundQueueCapacity = 256;
    }
    
    @Data
    public static class Session {
        @NotNull
        private Duration ttl = Duration.ofMinutes(15);
        @NotNull
        private Duration reconnectGrace = Duration.ofMinutes(15);
        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(5);
    }
    
    @Data
    public static class RateLimit {
        @Valid
        private Limit message = new Limit(100, Duration.ofMinutes(1));
        @Valid
        private Limit admin = new Limit(20, Duration.ofMinutes(1));
        @Valid
        private Limit publicEndpoints = new Limit(60, Duration.ofMinutes(1));
        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(5);
    }
    
    @Data
    public static class Limit {
        @Positive
        private int limit;
        @NotNull
        private Duration window;
        
        public Limit() {
        }
        
        public Limit(int limit, Duration window) {
            this.limit = limit;
            this.window = window;
        }
    }
    
    @Data
    public static class Llm {
        @NotBlank
        private String defaultModel = "llama-3.3-70b-versatile";
        /**
         * Model ids clients may select with a model_select message.
         */
        private List<String> models = new ArrayList<>(List.of("llama-3.3-70b-versatile", "llama-3.1-8b-instant"));
        @NotNull
        private Duration timeout = Duration.ofSeconds(120);
        @Positive
        private int maxHistoryMessages = 20;
        private String systemPrompt = "You are a helpful support assistant. Answer concisely.";
        /**
         * Additional providers. Each one is selectable under its id; the built-in Groq
         * provider serves the default model and {@link #models} not claimed here.
         */
        @Valid
        private List<Provider> providers = new ArrayList<>();
    }
    
    public enum ProviderType {
        OPENAI, ANTHROPIC, DIFY
    }
    
    @Data
    public static class Provider {
        @NotBlank
        private String id;
        private String name;
        @NotNull
        private ProviderType type;
        /**
         * API base URL; must be https.
         */
        @NotBlank
        private String endpoint;
        private String apiKey;
        /**
         * Upstream model name. Defaults to the id.
         */
        private String model;
    }
    
    @Data
    public static class Notification {
        /**
         * Webhook that receives help requests. Blank disables delivery (events are only logged).
         */
        private String webhookUrl = "";
        @NotNull
        private Duration dedupWindow = Duration.ofMinutes(5);
    }
    
    @Data
    public static class Jwt {
        private String secret;
    }
    
    @Data
    public static class Storage {
        @NotBlank
        private String sessionsCollection = "chat_sessions";
        @NotBlank
        private String messagesCollection = "chat_messages";
    }
}
