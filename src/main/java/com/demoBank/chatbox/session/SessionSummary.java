package com.demoBank.chatbox.session;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable point-in-time view of a session, safe to hand out of the registry.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionSummary {
    String sessionId;
    String userId;
    String name;
    String modelId;
    int messageCount;
    Instant startTime;
    Instant lastActivity;
    Instant endTime;
    boolean active;
    boolean helpRequested;
    boolean adminAssisted;
    String assistingAdminId;
    String assistingAdminName;
    long totalTokens;
    long averageResponseTimeMs;
    long maxResponseTimeMs;
    int connectionCount;
}
