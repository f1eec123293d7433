package com.demoBank.chatbox.storage;

import com.demoBank.chatbox.session.SessionMessage;
import com.demoBank.chatbox.session.SessionSummary;

import java.time.Instant;
import java.util.List;

/**
 * Durable storage for sessions and their messages.
 * Every write is idempotent; failures are reported as {@link StorageException}.
 */
public interface SessionStore {
    
    void createSession(SessionSummary session);
    
    void updateSession(SessionSummary session);
    
    void recordMessage(String sessionId, SessionMessage message);
    
    void endSession(String sessionId, Instant endTime);
    
    /**
     * Stored sessions of a user, newest first.
     */
    List<SessionSummary> listSessionsByUser(String userId, int limit);
    
    /**
     * Aggregates the sessions whose start time falls in {@code [start, end]}.
     */
    SessionMetrics aggregateMetrics(Instant start, Instant end);
    
    /**
     * Round trip to the database.
     * 
     * @throws StorageException if it cannot be reached
     */
    void ping();
}
