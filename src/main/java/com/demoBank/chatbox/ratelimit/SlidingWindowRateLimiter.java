package com.demoBank.chatbox.ratelimit;

import com.demoBank.chatbox.common.util.UserIdMasker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory sliding-window rate limiter.
 * 
 * Responsibilities:
 * - Admit or deny a request per key (user ID, admin ID or client IP)
 * - Report how long a denied key has to wait
 * - Periodically drop buckets that no longer hold any request
 * 
 * Check-and-record for a key happens inside a single {@link ConcurrentHashMap#compute} call,
 * so concurrent callers for the same key never admit more than {@code limit} requests per window.
 * Denied attempts are not recorded.
 */
@Slf4j
public class SlidingWindowRateLimiter {
    
    /**
     * Hard cap on timestamps kept per key.
     */
    static final int MAX_ENTRIES_PER_KEY = 1000;
    
    @Getter
    private final String name;
    @Getter
    private final int limit;
    @Getter
    private final Duration window;
    private final Duration cleanupInterval;
    private final Clock clock;
    
    // key -> timestamps of admitted requests, oldest first
    private final Map<String, RequestWindow> windows = new ConcurrentHashMap<>();
    
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ScheduledExecutorService cleanupExecutor;
    
    public SlidingWindowRateLimiter(String name, int limit, Duration window, Duration cleanupInterval) {
        this(name, limit, window, cleanupInterval, Clock.systemUTC());
    }
    
    public SlidingWindowRateLimiter(String name, int limit, Duration window, Duration cleanupInterval, Clock clock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.name = name;
        this.limit = limit;
        this.window = window;
        this.cleanupInterval = cleanupInterval;
        this.clock = clock;
    }
    
    /**
     * Checks whether a request for the key is allowed, and records it if so.
     * 
     * @param key Rate-limit key
     * @return true if the request is allowed, false if the limit is reached
     */
    public boolean allow(String key) {
        Instant now = clock.instant();
        boolean[] allowed = new boolean[1];
        windows.compute(key, (k, existing) -> {
            RequestWindow requestWindow = existing != null ? existing : new RequestWindow();
            requestWindow.evictBefore(cutoff(now));
            if (requestWindow.size() < limit) {
                requestWindow.add(now);
                allowed[0] = true;
            }
            return requestWindow;
        });
        
        if (!allowed[0]) {
            log.debug("Rate limit reached - limiter: {}, key: {}", name, UserIdMasker.mask(key));
        }
        return allowed[0];
    }
    
    /**
     * Time until the key may make its next request.
     * 
     * @param key Rate-limit key
     * @return Zero if the key is under its limit, otherwise time until the oldest entry leaves the window
     */
    public Duration getRetryAfter(String key) {
        Instant now = clock.instant();
        Duration[] retryAfter = {Duration.ZERO};
        windows.computeIfPresent(key, (k, requestWindow) -> {
            requestWindow.evictBefore(cutoff(now));
            if (requestWindow.size() >= limit) {
                Duration remaining = Duration.between(now, requestWindow.oldest().plus(window));
                retryAfter[0] = remaining.isNegative() ? Duration.ZERO : remaining;
            }
            return requestWindow;
        });
        return retryAfter[0];
    }
    
    /**
     * Retry-after rounded up to whole seconds, never less than 1.
     */
    public int getRetryAfterSeconds(String key) {
        return toRetryAfterSeconds(getRetryAfter(key));
    }
    
    /**
     * Forgets every request recorded for the key.
     */
    public void reset(String key) {
        windows.remove(key);
    }
    
    /**
     * Number of keys that currently hold a bucket.
     */
    public int trackedKeys() {
        return windows.size();
    }
    
    /**
     * Evicts expired timestamps and drops buckets that end up empty.
     * 
     * @return Number of buckets removed
     */
    public int cleanup() {
        Instant cutoff = cutoff(clock.instant());
        AtomicInteger removed = new AtomicInteger();
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, requestWindow) -> {
                requestWindow.evictBefore(cutoff);
                if (requestWindow.size() == 0) {
                    removed.incrementAndGet();
                    return null;
                }
                return requestWindow;
            });
        }
        if (removed.get() > 0) {
            log.debug("Rate limiter cleanup - limiter: {}, removedKeys: {}, remainingKeys: {}", 
                    name, removed.get(), windows.size());
        }
        return removed.get();
    }
    
    /**
     * Starts the periodic cleanup task. Calling it twice has no effect.
     */
    public void start() {
        if (cleanupInterval == null || stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ratelimit-cleanup-" + name);
            thread.setDaemon(true);
            return thread;
        });
        long intervalMillis = cleanupInterval.toMillis();
        cleanupExecutor.scheduleAtFixedRate(this::runCleanup, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Rate limiter started - limiter: {}, limit: {}, window: {}", name, limit, window);
    }
    
    /**
     * Stops the cleanup task. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService executor = cleanupExecutor;
        if (executor != null) {
            executor.shutdownNow();
        }
        log.info("Rate limiter stopped - limiter: {}", name);
    }
    
    public boolean isStopped() {
        return stopped.get();
    }
    
    static int toRetryAfterSeconds(Duration retryAfter) {
        long millis = retryAfter.toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.max(1, seconds);
    }
    
    private void runCleanup() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.error("Rate limiter cleanup failed - limiter: {}", name, e);
        }
    }
    
    private Instant cutoff(Instant now) {
        return now.minus(window);
    }
    
    /**
     * Timestamps of admitted requests for one key. Only touched from inside map compute calls.
     */
    private static class RequestWindow {
        private final Deque<Instant> requests = new ArrayDeque<>();
        
        void add(Instant timestamp) {
            if (requests.size() >= MAX_ENTRIES_PER_KEY) {
                requests.pollFirst();
            }
            requests.addLast(timestamp);
        }
        
        void evictBefore(Instant cutoff) {
            while (!requests.isEmpty() && !requests.peekFirst().isAfter(cutoff)) {
                requests.pollFirst();
            }
        }
        
        int size() {
            return requests.size();
        }
        
        Instant oldest() {
            return requests.peekFirst();
        }
    }
}
