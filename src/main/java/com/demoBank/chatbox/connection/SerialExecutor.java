package com.demoBank.chatbox.connection;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor.
 * A task may return a stage; the next task starts once that stage completes, and the
 * pool thread is released in the meantime.
 * The backlog is bounded; {@link #offer(Runnable)} returns false once it is full.
 */
@Slf4j
class SerialExecutor {
    
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor executor;
    private final int capacity;
    private Runnable active;
    private boolean shutdown;
    
    SerialExecutor(Executor executor, int capacity) {
        this.executor = executor;
        this.capacity = capacity;
    }
    
    boolean offer(Runnable task) {
        return offerAsync(() -> {
            task.run();
            return null;
        });
    }
    
    synchronized boolean offerAsync(Supplier<? extends CompletionStage<?>> task) {
        if (shutdown || tasks.size() >= capacity) {
            return false;
        }
        tasks.add(() -> {
            CompletionStage<?> stage = null;
            try {
                stage = task.get();
            } catch (RuntimeException e) {
                log.error("Queued task failed", e);
            } finally {
                if (stage == null) {
                    scheduleNext();
                } else {
                    stage.whenComplete((result, error) -> scheduleNext());
                }
            }
        });
        if (active == null) {
            scheduleNext();
        }
        return true;
    }
    
    synchronized int pending() {
        return tasks.size();
    }
    
    /**
     * Drops queued tasks and refuses new ones. A task already running is left to finish.
     */
    synchronized void shutdown() {
        shutdown = true;
        tasks.clear();
    }
    
    private synchronized void scheduleNext() {
        active = tasks.poll();
        if (active != null) {
            try {
                executor.execute(active);
            } catch (RejectedExecutionException e) {
                log.warn("Executor rejected task, dropping backlog - pending: {}", tasks.size(), e);
                tasks.clear();
                active = null;
            }
        }
    }
}
