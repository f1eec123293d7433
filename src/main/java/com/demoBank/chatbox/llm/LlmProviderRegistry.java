package com.demoBank.chatbox.llm;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the model IDs clients may select to the provider that serves them.
 */
public class LlmProviderRegistry {
    
    private final Map<String, Route> routes = new LinkedHashMap<>();
    
    /**
     * @throws IllegalStateException if two routes share a model ID
     */
    public LlmProviderRegistry(Collection<Route> routes) {
        for (Route route : routes) {
            if (this.routes.putIfAbsent(route.modelId(), route) != null) {
                throw new IllegalStateException("Duplicate LLM model id: " + route.modelId());
            }
        }
    }
    
    public Optional<Route> find(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(routes.get(modelId));
    }
    
    public List<String> modelIds() {
        return List.copyOf(routes.keySet());
    }
    
    /**
     * @return Number of distinct providers behind the routes
     */
    public int providerCount() {
        return (int) routes.values().stream().map(Route::provider).distinct().count();
    }
    
    /**
     * @param modelId ID clients select
     * @param provider Provider that serves it
     * @param upstreamModel Model name sent to the provider
     */
    public record Route(String modelId, LlmProvider provider, String upstreamModel) {
    }
}
