package com.demoBank.chatbox.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Event sent to the admin notification channel.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationEvent {
    
    public enum Type {
        @JsonProperty("help_requested")
        HELP_REQUESTED,
        @JsonProperty("admin_takeover")
        ADMIN_TAKEOVER
    }
    
    @JsonProperty("type")
    Type type;
    
    @JsonProperty("session_id")
    String sessionId;
    
    @JsonProperty("user_id")
    String userId;
    
    @JsonProperty("user_name")
    String userName;
    
    @JsonProperty("session_name")
    String sessionName;
    
    @JsonProperty("timestamp")
    Instant timestamp;
}
