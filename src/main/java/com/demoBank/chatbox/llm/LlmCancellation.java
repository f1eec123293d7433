package com.demoBank.chatbox.llm;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation handle for one provider call.
 * 
 * A thread blocked reading a response body does not notice interruption on every transport,
 * so the provider registers the open response here and {@link #cancel()} closes it.
 */
@Slf4j
public class LlmCancellation {
    
    private final List<Closeable> resources = new ArrayList<>();
    private boolean cancelled;
    
    /**
     * Registers a resource to close on cancel. Closed at once if the call is already cancelled.
     */
    public void register(Closeable resource) {
        synchronized (this) {
            if (!cancelled) {
                resources.add(resource);
                return;
            }
        }
        closeQuietly(resource);
    }
    
    public void cancel() {
        List<Closeable> toClose;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toClose = new ArrayList<>(resources);
            resources.clear();
        }
        toClose.forEach(LlmCancellation::closeQuietly);
    }
    
    public synchronized boolean isCancelled() {
        return cancelled;
    }
    
    private static void closeQuietly(Closeable resource) {
        try {
            resource.close();
        } catch (IOException | RuntimeException e) {
            log.debug("Error closing cancelled LLM response - error: {}", e.getMessage());
        }
    }
}
