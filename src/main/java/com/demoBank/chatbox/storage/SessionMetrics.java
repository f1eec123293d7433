package com.demoBank.chatbox.storage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Totals over the stored sessions that started in a time range.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionMetrics {
    long totalSessions;
    
    /**
     * Sessions without an end time.
     */
    long activeSessions;
    long adminAssistedCount;
    long totalTokens;
    long maxResponseTimeMs;
    
    /**
     * Mean of the per-session average response times, over sessions that recorded one.
     */
    long avgResponseTimeMs;
}
