package com.demoBank.chatbox.llm;

import com.demoBank.chatbox.config.ChatboxProperties;
import com.demoBank.chatbox.message.SenderType;
import com.demoBank.chatbox.metrics.ChatMetrics;
import com.demoBank.chatbox.session.SessionMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Entry point for AI replies.
 * 
 * Responsibilities:
 * - Know which model IDs clients may select and which provider serves each
 * - Turn session history into a provider request
 * - Run the blocking provider call on the LLM pool and hand back a future that completes with the reply,
 *   fails after the configured timeout, and aborts the provider call when cancelled
 * - Record LLM metrics per provider
 */
@Slf4j
@Service
public class LlmService {
    
    private final LlmProviderRegistry registry;
    private final AsyncTaskExecutor llmExecutor;
    private final ChatboxProperties.Llm settings;
    private final ChatMetrics metrics;
    
    public LlmService(LlmProviderRegistry registry,
                      @Qualifier("llmExecutor") AsyncTaskExecutor llmExecutor,
                      ChatboxProperties properties,
                      ChatMetrics metrics) {
        this.registry = registry;
        this.llmExecutor = llmExecutor;
        this.settings = properties.getLlm();
        this.metrics = metrics;
    }
    
    public boolean isKnownModel(String modelId) {
        return registry.find(modelId).isPresent();
    }
    
    public String getDefaultModel() {
        return settings.getDefaultModel();
    }
    
    public List<String> getAvailableModels() {
        return registry.modelIds();
    }
    
    public int getProviderCount() {
        return registry.providerCount();
    }
    
    public Duration getTimeout() {
        return settings.getTimeout();
    }
    
    /**
     * Starts streaming a reply to the conversation. Does not block.
     * 
     * @param modelId Model to use; null or blank means the default model
     * @param history Session history, oldest first; the last message is the one being answered
     * @param onChunk Receives partial content as it arrives, on an LLM pool thread
     * @return Future of the full reply. It fails with a {@link java.util.concurrent.TimeoutException} after
     *         the configured timeout; cancelling it stops the provider call.
     */
    public CompletableFuture<LlmResponse> stream(String modelId, List<SessionMessage> history, Consumer<String> onChunk) {
        String model = modelId == null || modelId.isBlank() ? settings.getDefaultModel() : modelId;
        LlmProviderRegistry.Route route = registry.find(model).orElse(null);
        if (route == null) {
            return CompletableFuture.failedFuture(new LlmException("No provider serves model " + model));
        }
        LlmProvider provider = route.provider();
        LlmRequest request = LlmRequest.builder()
                .model(route.upstreamModel())
                .turns(toTurns(history))
                .build();
        log.debug("Submitting LLM request - provider: {}, model: {}, turns: {}", 
                provider.getName(), model, request.getTurns().size());
        
        LlmCancellation cancellation = new LlmCancellation();
        CompletableFuture<LlmResponse> result = new CompletableFuture<>();
        metrics.recordLlmRequest(provider.getName());
        long started = System.nanoTime();
        
        Future<?> task;
        try {
            task = llmExecutor.submit(() -> {
                try {
                    LlmResponse response = provider.stream(request, onChunk, cancellation);
                    // recorded before completing so callers observe the metrics with the reply
                    if (!result.isDone()) {
                        metrics.recordLlmLatency(provider.getName(), Duration.ofNanos(System.nanoTime() - started));
                        metrics.recordTokensUsed(provider.getName(), response.getTotalTokens());
                    }
                    result.complete(response);
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (TaskRejectedException e) {
            log.error("LLM pool rejected request - provider: {}, model: {}", provider.getName(), model);
            metrics.recordLlmError(provider.getName());
            return CompletableFuture.failedFuture(new LlmException("LLM pool is saturated", e));
        }
        
        result.orTimeout(settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        result.whenComplete((response, error) -> {
            if (error == null) {
                return;
            }
            metrics.recordLlmLatency(provider.getName(), Duration.ofNanos(System.nanoTime() - started));
            if (!(unwrap(error) instanceof CancellationException)) {
                metrics.recordLlmError(provider.getName());
            }
            cancellation.cancel();
            task.cancel(true);
        });
        return result;
    }
    
    /**
     * Strips the {@link CompletionException} wrapper dependent stages add.
     */
    public static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
    
    /**
     * Estimates token usage when the provider does not report it (about 4 characters per token).
     */
    public static long estimateTokens(String text) {
        return text == null ? 0 : text.length() / 4;
    }
    
    private List<LlmRequest.Turn> toTurns(List<SessionMessage> history) {
        List<LlmRequest.Turn> turns = new ArrayList<>();
        if (settings.getSystemPrompt() != null && !settings.getSystemPrompt().isBlank()) {
            turns.add(new LlmRequest.Turn("system", settings.getSystemPrompt()));
        }
        int from = Math.max(0, history.size() - settings.getMaxHistoryMessages());
        for (SessionMessage message : history.subList(from, history.size())) {
            if (message.getContent() == null || message.getContent().isBlank()) {
                continue;
            }
            String role = message.getSender() == SenderType.USER ? "user" : "assistant";
            if (message.getSender() == SenderType.SYSTEM) {
                continue;
            }
            turns.add(new LlmRequest.Turn(role, message.getContent()));
        }
        return turns;
    }
}
