package com.demoBank.chatbox.message;

import com.demoBank.chatbox.common.exception.ChatException;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One WebSocket text frame, in either direction.
 * 
 * Null fields are left out of the JSON. Timestamps are RFC 3339 strings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMessage {
    
    @JsonProperty("type")
    private MessageType type;
    
    @JsonProperty("session_id")
    private String sessionId;
    
    @JsonProperty("content")
    private String content;
    
    @JsonProperty("file_id")
    private String fileId;
    
    @JsonProperty("file_url")
    private String fileUrl;
    
    @JsonProperty("model_id")
    private String modelId;
    
    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant timestamp;
    
    @JsonProperty("sender")
    private SenderType sender;
    
    @JsonProperty("metadata")
    private Map<String, String> metadata;
    
    @JsonProperty("error")
    private ErrorInfo error;
    
    public static ChatMessage error(String sessionId, ChatException ex) {
        return ChatMessage.builder()
                .type(MessageType.ERROR)
                .sessionId(sessionId)
                .sender(SenderType.SYSTEM)
                .timestamp(Instant.now())
                .error(ErrorInfo.from(ex))
                .build();
    }
    
    public static ChatMessage status(String sessionId, Map<String, String> metadata) {
        return ChatMessage.builder()
                .type(MessageType.CONNECTION_STATUS)
                .sessionId(sessionId)
                .sender(SenderType.SYSTEM)
                .timestamp(Instant.now())
                .metadata(metadata)
                .build();
    }
    
    public static ChatMessage loading(String sessionId) {
        return ChatMessage.builder()
                .type(MessageType.LOADING)
                .sessionId(sessionId)
                .sender(SenderType.SYSTEM)
                .timestamp(Instant.now())
                .build();
    }
}
