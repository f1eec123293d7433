package com.demoBank.chatbox.session;

import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.config.ChatboxProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory registry of chat sessions.
 * 
 * Responsibilities:
 * - Create sessions and resume them across reconnects (within the grace window)
 * - Enforce session ownership
 * - Apply every session mutation (messages, model, help flag, admin takeover, metrics)
 * - Sweep idle sessions on a fixed interval
 * 
 * A single lock guards the map and every compound check-and-set, so there is exactly one
 * {@link ChatSession} object per ID and at most one admin per session.
 */
@Slf4j
@Service
public class SessionRegistry {
    
    private final Map<String, ChatSession> sessions = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    
    private final Duration ttl;
    private final Duration reconnectGrace;
    private final Duration cleanupInterval;
    private final Clock clock;
    
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong createdCount = new AtomicLong();
    private final AtomicLong endedCount = new AtomicLong();
    private volatile ScheduledExecutorService sweepExecutor;
    
    @Autowired
    public SessionRegistry(ChatboxProperties properties) {
        this(properties.getSession().getTtl(),
                properties.getSession().getReconnectGrace(),
                properties.getSession().getCleanupInterval(),
                Clock.systemUTC());
    }
    
    public SessionRegistry(Duration ttl, Duration reconnectGrace, Duration cleanupInterval, Clock clock) {
        this.ttl = ttl;
        this.reconnectGrace = reconnectGrace;
        this.cleanupInterval = cleanupInterval;
        this.clock = clock;
    }
    
    /**
     * Creates a new session with a freshly generated ID.
     * 
     * @param userId Owner of the session
     * @return The new session
     */
    public ChatSession createSession(String userId) {
        requireUserId(userId);
        lock.lock();
        try {
            return createLocked(userId);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Resumes the requested session or creates a new one.
     * 
     * - Unknown or blank ID: a new session with a new ID
     * - Owned by another user: {@link SessionOwnershipException}, the session is left untouched
     * - Active, or ended within the reconnect grace window: the same object, reactivated
     * - Ended beyond the grace window: the stale session is dropped and a new one is created
     * 
     * @param sessionId Requested session ID (may be null)
     * @param userId Authenticated user
     * @return The resumed or created session
     */
    public ChatSession getOrCreateSession(String sessionId, String userId) {
        requireUserId(userId);
        lock.lock();
        try {
            if (sessionId == null || sessionId.isBlank()) {
                return createLocked(userId);
            }
            
            ChatSession existing = sessions.get(sessionId);
            if (existing == null) {
                log.debug("Requested session not found, creating a new one - sessionId: {}, userId: {}", 
                        sessionId, UserIdMasker.mask(userId));
                return createLocked(userId);
            }
            
            if (!existing.getUserId().equals(userId)) {
                log.warn("Session ownership mismatch - sessionId: {}, userId: {}", 
                        sessionId, UserIdMasker.mask(userId));
                throw new SessionOwnershipException();
            }
            
            Instant now = clock.instant();
            Instant endTime = existing.getEndTime();
            if (endTime != null && Duration.between(endTime, now).compareTo(reconnectGrace) > 0) {
                sessions.remove(sessionId);
                log.info("Session past reconnect grace, starting a new one - sessionId: {}, userId: {}", 
                        sessionId, UserIdMasker.mask(userId));
                return createLocked(userId);
            }
            
            if (endTime != null) {
                existing.reactivate(now);
                log.info("Session restored - sessionId: {}, userId: {}", sessionId, UserIdMasker.mask(userId));
            } else {
                existing.touch(now);
            }
            return existing;
        } finally {
            lock.unlock();
        }
    }
    
    public Optional<ChatSession> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.unlock();
        }
    }
    
    public ChatSession requireSession(String sessionId) {
        return getSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
    
    /**
     * Ends the session. Only the first call sets the end time.
     * 
     * @return true if this call ended the session
     */
    public boolean endSession(String sessionId) {
        lock.lock();
        try {
            ChatSession session = sessions.get(sessionId);
            if (session == null) {
                throw new SessionNotFoundException(sessionId);
            }
            boolean ended = session.end(clock.instant());
            if (ended) {
                endedCount.incrementAndGet();
                log.info("Session ended - sessionId: {}", sessionId);
            }
            return ended;
        } finally {
            lock.unlock();
        }
    }
    
    public SessionMessage recordMessage(String sessionId, SessionMessage message) {
        lock.lock();
        try {
            ChatSession session = requireLocked(sessionId);
            session.addMessage(message, clock.instant());
            return message;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Names the session after the given message, unless it already has a name.
     */
    public void setSessionNameFromMessage(String sessionId, String message) {
        lock.lock();
        try {
            requireLocked(sessionId).setNameIfAbsent(SessionNameGenerator.generate(message));
        } finally {
            lock.unlock();
        }
    }
    
    public void setModel(String sessionId, String modelId) {
        lock.lock();
        try {
            requireLocked(sessionId).setModelId(modelId, clock.instant());
        } finally {
            lock.unlock();
        }
    }
    
    public void markHelpRequested(String sessionId) {
        lock.lock();
        try {
            requireLocked(sessionId).markHelpRequested(clock.instant());
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Assigns an admin to the session. At most one admin can assist a session at a time.
     * 
     * @throws SessionNotFoundException if the session does not exist
     * @throws AdminAssistanceConflictException if the session is already assisted
     */
    public SessionSummary setAdminAssistance(String sessionId, String adminId, String adminName) {
        lock.lock();
        try {
            ChatSession session = requireLocked(sessionId);
            if (session.isAdminAssisted()) {
                log.info("Takeover rejected, session already assisted - sessionId: {}, adminId: {}", 
                        sessionId, UserIdMasker.mask(adminId));
                throw new AdminAssistanceConflictException("Session is already assisted by an admin");
            }
            session.assignAdmin(adminId, adminName, clock.instant());
            log.info("Admin took over session - sessionId: {}, adminId: {}", sessionId, UserIdMasker.mask(adminId));
            return session.toSummary();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Releases admin assistance. Only the assisting admin can release it.
     */
    public SessionSummary clearAdminAssistance(String sessionId, String adminId) {
        lock.lock();
        try {
            ChatSession session = requireLocked(sessionId);
            if (!session.isAssistedBy(adminId)) {
                throw new AdminAssistanceConflictException("Session is not assisted by this admin");
            }
            session.clearAdmin(clock.instant());
            log.info("Admin left session - sessionId: {}, adminId: {}", sessionId, UserIdMasker.mask(adminId));
            return session.toSummary();
        } finally {
            lock.unlock();
        }
    }
    
    public void recordTokenUsage(String sessionId, long tokens) {
        if (tokens <= 0) {
            return;
        }
        lock.lock();
        try {
            requireLocked(sessionId).addTokens(tokens);
        } finally {
            lock.unlock();
        }
    }
    
    public void recordResponseTime(String sessionId, Duration duration) {
        lock.lock();
        try {
            requireLocked(sessionId).addResponseTime(duration);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Counts a live connection against the session. Sessions with live connections are never swept.
     */
    public void attachConnection(String sessionId) {
        lock.lock();
        try {
            ChatSession session = requireLocked(sessionId);
            session.incrementConnections();
            session.touch(clock.instant());
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Releases a live connection. When the last one goes the session is ended,
     * which starts its reconnect grace window.
     * 
     * @return true if this call ended the session
     */
    public boolean detachConnection(String sessionId) {
        lock.lock();
        try {
            ChatSession session = sessions.get(sessionId);
            if (session == null || session.decrementConnections() > 0) {
                return false;
            }
            boolean ended = session.end(clock.instant());
            if (ended) {
                endedCount.incrementAndGet();
                log.info("Session ended, last connection closed - sessionId: {}", sessionId);
            }
            return ended;
        } finally {
            lock.unlock();
        }
    }
    
    public Optional<SessionSummary> snapshot(String sessionId) {
        return getSession(sessionId).map(ChatSession::toSummary);
    }
    
    /**
     * @return Summaries of every session in memory, newest first
     */
    public List<SessionSummary> listSessions() {
        List<ChatSession> copy;
        lock.lock();
        try {
            copy = new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
        return copy.stream()
                .map(ChatSession::toSummary)
                .sorted(Comparator.comparing(SessionSummary::getStartTime).reversed())
                .toList();
    }
    
    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * @return Sessions in memory that have not ended
     */
    public int activeCount() {
        lock.lock();
        try {
            return (int) sessions.values().stream().filter(ChatSession::isActive).count();
        } finally {
            lock.unlock();
        }
    }
    
    public long createdCount() {
        return createdCount.get();
    }
    
    public long endedCount() {
        return endedCount.get();
    }
    
    /**
     * Removes sessions idle for longer than the TTL.
     * Active sessions that still have a live connection are kept regardless of idle time.
     * 
     * @return Number of sessions removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, ChatSession>> iterator = sessions.entrySet().iterator();
            while (iterator.hasNext()) {
                ChatSession session = iterator.next().getValue();
                if (session.isActive() && session.getConnectionCount() > 0) {
                    continue;
                }
                if (Duration.between(session.getLastActivity(), now).compareTo(ttl) > 0) {
                    iterator.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.info("Swept expired sessions - removed: {}, remaining: {}", removed, size());
        }
        return removed;
    }
    
    /**
     * Starts the periodic sweep. Calling it more than once has no effect.
     */
    @PostConstruct
    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "session-sweep");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMillis = cleanupInterval.toMillis();
        sweepExecutor.scheduleAtFixedRate(this::runSweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Session sweep started - interval: {}, ttl: {}", cleanupInterval, ttl);
    }
    
    /**
     * @return true between {@link #start()} and {@link #stop()}
     */
    public boolean isRunning() {
        return started.get() && !stopped.get();
    }
    
    /**
     * Stops the sweep. Idempotent. A stopped registry cannot be started again.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService executor = sweepExecutor;
        if (executor != null) {
            executor.shutdownNow();
        }
        log.info("Session sweep stopped");
    }
    
    private void runSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Session sweep failed", e);
        }
    }
    
    private ChatSession createLocked(String userId) {
        Instant now = clock.instant();
        String id = UUID.randomUUID().toString().replace("-", "");
        ChatSession session = new ChatSession(id, userId, now);
        sessions.put(id, session);
        createdCount.incrementAndGet();
        log.info("Created new session - userId: {}, sessionId: {}", UserIdMasker.mask(userId), id);
        return session;
    }
    
    private ChatSession requireLocked(String sessionId) {
        ChatSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }
    
    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }
}
