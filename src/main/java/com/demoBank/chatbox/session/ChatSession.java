package com.demoBank.chatbox.session;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Conversational state of one chat session.
 * 
 * Mutators are package-private and only called by {@link SessionRegistry} while it holds its lock.
 * Every accessor synchronizes on the session, so callers outside the registry always see a consistent state.
 * Lock order is registry lock first, then the session monitor.
 */
public class ChatSession {
    
    static final int MAX_RESPONSE_TIME_SAMPLES = 100;
    
    private final String id;
    private final String userId;
    private final Instant startTime;
    
    private String name;
    private String modelId;
    private final List<SessionMessage> messages = new ArrayList<>();
    private Instant lastActivity;
    private Instant endTime;
    private boolean active;
    private boolean helpRequested;
    private boolean adminAssisted;
    private String assistingAdminId;
    private String assistingAdminName;
    private long totalTokens;
    private final Deque<Duration> responseTimes = new ArrayDeque<>();
    private int connectionCount;
    
    ChatSession(String id, String userId, Instant now) {
        this.id = id;
        this.userId = userId;
        this.startTime = now;
        this.lastActivity = now;
        this.active = true;
    }
    
    public String getId() {
        return id;
    }
    
    public String getUserId() {
        return userId;
    }
    
    public Instant getStartTime() {
        return startTime;
    }
    
    public synchronized String getName() {
        return name;
    }
    
    public synchronized String getModelId() {
        return modelId;
    }
    
    public synchronized List<SessionMessage> getMessages() {
        return List.copyOf(messages);
    }
    
    public synchronized Instant getLastActivity() {
        return lastActivity;
    }
    
    public synchronized Instant getEndTime() {
        return endTime;
    }
    
    public synchronized boolean isActive() {
        return active;
    }
    
    public synchronized boolean isHelpRequested() {
        return helpRequested;
    }
    
    public synchronized boolean isAdminAssisted() {
        return adminAssisted;
    }
    
    public synchronized String getAssistingAdminId() {
        return assistingAdminId;
    }
    
    public synchronized String getAssistingAdminName() {
        return assistingAdminName;
    }
    
    public synchronized long getTotalTokens() {
        return totalTokens;
    }
    
    public synchronized int getConnectionCount() {
        return connectionCount;
    }
    
    public synchronized boolean isAssistedBy(String adminId) {
        return adminAssisted && adminId != null && adminId.equals(assistingAdminId);
    }
    
    public synchronized Duration getAverageResponseTime() {
        if (responseTimes.isEmpty()) {
            return Duration.ZERO;
        }
        Duration total = Duration.ZERO;
        for (Duration sample : responseTimes) {
            total = total.plus(sample);
        }
        return total.dividedBy(responseTimes.size());
    }
    
    public synchronized Duration getMaxResponseTime() {
        Duration max = Duration.ZERO;
        for (Duration sample : responseTimes) {
            if (sample.compareTo(max) > 0) {
                max = sample;
            }
        }
        return max;
    }
    
    public synchronized SessionSummary toSummary() {
        return SessionSummary.builder()
                .sessionId(id)
                .userId(userId)
                .name(name)
                .modelId(modelId)
                .messageCount(messages.size())
                .startTime(startTime)
                .lastActivity(lastActivity)
                .endTime(endTime)
                .active(active)
                .helpRequested(helpRequested)
                .adminAssisted(adminAssisted)
                .assistingAdminId(assistingAdminId)
                .assistingAdminName(assistingAdminName)
                .totalTokens(totalTokens)
                .averageResponseTimeMs(getAverageResponseTime().toMillis())
                .maxResponseTimeMs(getMaxResponseTime().toMillis())
                .connectionCount(connectionCount)
                .build();
    }
    
    // Mutators, registry only
    
    synchronized void touch(Instant now) {
        lastActivity = now;
    }
    
    synchronized void addMessage(SessionMessage message, Instant now) {
        messages.add(message);
        lastActivity = now;
    }
    
    synchronized void setNameIfAbsent(String newName) {
        if (name == null || name.isEmpty()) {
            name = newName;
        }
    }
    
    synchronized void setModelId(String modelId, Instant now) {
        this.modelId = modelId;
        lastActivity = now;
    }
    
    synchronized void markHelpRequested(Instant now) {
        helpRequested = true;
        lastActivity = now;
    }
    
    synchronized void assignAdmin(String adminId, String adminName, Instant now) {
        adminAssisted = true;
        assistingAdminId = adminId;
        assistingAdminName = adminName;
        lastActivity = now;
    }
    
    synchronized void clearAdmin(Instant now) {
        adminAssisted = false;
        assistingAdminId = null;
        assistingAdminName = null;
        lastActivity = now;
    }
    
    synchronized void addTokens(long tokens) {
        totalTokens += tokens;
    }
    
    synchronized void addResponseTime(Duration duration) {
        if (responseTimes.size() >= MAX_RESPONSE_TIME_SAMPLES) {
            responseTimes.pollFirst();
        }
        responseTimes.addLast(duration);
    }
    
    /**
     * @return true if this call ended the session, false if it had already ended
     */
    synchronized boolean end(Instant now) {
        if (!active) {
            return false;
        }
        active = false;
        endTime = now;
        return true;
    }
    
    synchronized void reactivate(Instant now) {
        active = true;
        endTime = null;
        lastActivity = now;
    }
    
    synchronized int incrementConnections() {
        return ++connectionCount;
    }
    
    synchronized int decrementConnections() {
        if (connectionCount > 0) {
            connectionCount--;
        }
        return connectionCount;
    }
}
