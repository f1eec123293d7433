package com.demoBank.chatbox.llm;

import java.util.function.Consumer;

/**
 * A backend that produces AI replies.
 */
public interface LlmProvider {
    
    /**
     * Provider name used in logs and metric tags, e.g. "groq" or "anthropic".
     */
    String getName();
    
    /**
     * Streams a completion. Blocks until the reply is complete.
     * Implementations register their open response with the cancellation handle and stop early once it is cancelled.
     * 
     * @param request Upstream model and conversation
     * @param onChunk Receives each partial piece of content as it arrives
     * @param cancellation Handle the caller uses to abort the call
     * @return The full reply
     * @throws LlmException if the provider fails or the call was cancelled
     */
    LlmResponse stream(LlmRequest request, Consumer<String> onChunk, LlmCancellation cancellation);
}
