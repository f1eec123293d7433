package com.demoBank.chatbox.llm;

import com.demoBank.chatbox.config.ChatboxProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the provider registry from {@code groq.api.*} and {@code chatbox.llm.providers}.
 */
@Slf4j
@Configuration
public class LlmConfiguration {
    
    private static final String GROQ_API_URL = "https://api.groq.com/openai/v1/chat/completions";
    
    @Bean
    public LlmProviderRegistry llmProviderRegistry(ObjectMapper objectMapper,
                                                   ChatboxProperties properties,
                                                   @Value("${groq.api.url:" + GROQ_API_URL + "}") String groqApiUrl,
                                                   @Value("${groq.api.key:}") String groqApiKey,
                                                   @Value("${groq.api.temperature:0.3}") Double temperature,
                                                   @Value("${groq.api.max-completion-tokens:1024}") Integer maxCompletionTokens) {
        ChatboxProperties.Llm settings = properties.getLlm();
        Duration timeout = settings.getTimeout();
        
        List<LlmProviderRegistry.Route> routes = new ArrayList<>();
        Set<String> claimed = new LinkedHashSet<>();
        for (ChatboxProperties.Provider config : settings.getProviders()) {
            LlmProvider provider = createProvider(config, objectMapper, timeout, temperature, maxCompletionTokens);
            String upstream = config.getModel() == null || config.getModel().isBlank() ? config.getId() : config.getModel();
            routes.add(new LlmProviderRegistry.Route(config.getId(), provider, upstream));
            claimed.add(config.getId());
            log.info("Registered LLM provider - id: {}, type: {}", config.getId(), config.getType());
        }
        
        OpenAiLlmProvider groq = new OpenAiLlmProvider("groq", restClient(timeout), objectMapper,
                groqApiUrl, groqApiKey, temperature, maxCompletionTokens);
        Set<String> groqModels = new LinkedHashSet<>();
        groqModels.add(settings.getDefaultModel());
        groqModels.addAll(settings.getModels());
        groqModels.removeAll(claimed);
        for (String model : groqModels) {
            routes.add(new LlmProviderRegistry.Route(model, groq, model));
        }
        log.info("Registered Groq models - models: {}", groqModels);
        
        return new LlmProviderRegistry(routes);
    }
    
    static LlmProvider createProvider(ChatboxProperties.Provider config, ObjectMapper objectMapper, Duration timeout,
                                      Double temperature, Integer maxCompletionTokens) {
        String endpoint = requireHttpsEndpoint(config);
        return switch (config.getType()) {
            case OPENAI -> new OpenAiLlmProvider("openai", restClient(timeout), objectMapper,
                    endpoint + "/chat/completions", config.getApiKey(), temperature, maxCompletionTokens);
            case ANTHROPIC -> new AnthropicLlmProvider(restClient(timeout), objectMapper, endpoint, config.getApiKey());
            case DIFY -> new DifyLlmProvider(restClient(timeout), objectMapper, endpoint, config.getApiKey());
        };
    }
    
    /**
     * @return The endpoint without a trailing slash
     * @throws IllegalStateException if it is not an absolute https URL with a host
     */
    static String requireHttpsEndpoint(ChatboxProperties.Provider config) {
        String endpoint = config.getEndpoint();
        URI uri;
        try {
            uri = URI.create(endpoint);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid endpoint for LLM provider " + config.getId(), e);
        }
        if (!"https".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalStateException("LLM provider " + config.getId() + " endpoint must be an https URL with a host");
        }
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
    
    private static RestClient.Builder restClient(Duration timeout) {
        return RestClient.builder().requestFactory(StreamingLlmProvider.requestFactory(timeout));
    }
}
