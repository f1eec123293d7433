package com.demoBank.chatbox.message;

import com.demoBank.chatbox.common.exception.ChatException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Validates inbound frames before they reach the router.
 * 
 * Responsibilities:
 * - Reject unknown types and frames missing type-specific fields
 * - Enforce field length limits
 * - Fill in server-side defaults (timestamp, sender)
 */
@Component
public class MessageValidator {
    
    static final int MAX_CONTENT_LENGTH = 10_000;
    static final int MAX_METADATA_VALUE_LENGTH = 1_000;
    static final int MAX_FILE_ID_LENGTH = 255;
    static final int MAX_FILE_URL_LENGTH = 2_048;
    static final int MAX_MODEL_ID_LENGTH = 100;
    static final int MAX_SESSION_ID_LENGTH = 128;
    
    private static final Duration CLOCK_SKEW_TOLERANCE = Duration.ofMinutes(1);
    
    /**
     * Validates the message and applies defaults in place.
     * 
     * @param message Inbound message
     * @throws ChatException with INVALID_FORMAT or MISSING_FIELD when the message is rejected
     */
    public void validate(ChatMessage message) {
        if (message == null) {
            throw ChatException.invalidFormat("empty frame");
        }
        if (message.getType() == null) {
            throw ChatException.missingField("type");
        }
        if (message.getType() == MessageType.UNKNOWN) {
            throw ChatException.invalidFormat("unknown message type");
        }
        
        if (message.getTimestamp() == null) {
            message.setTimestamp(Instant.now());
        } else if (message.getTimestamp().isAfter(Instant.now().plus(CLOCK_SKEW_TOLERANCE))) {
            throw ChatException.invalidFormat("timestamp cannot be in the future");
        }
        if (message.getSender() == null) {
            message.setSender(SenderType.USER);
        }
        
        validateTypeSpecificFields(message);
        validateFieldLengths(message);
    }
    
    private void validateTypeSpecificFields(ChatMessage message) {
        switch (message.getType()) {
            case USER_MESSAGE -> requireNonBlank(message.getContent(), "content");
            case FILE_UPLOAD, VOICE_MESSAGE -> {
                requireNonBlank(message.getFileId(), "file_id");
                requireNonBlank(message.getFileUrl(), "file_url");
            }
            case MODEL_SELECT -> requireNonBlank(message.getModelId(), "model_id");
            case ADMIN_TAKEOVER, ADMIN_LEAVE -> requireNonBlank(message.getSessionId(), "session_id");
            default -> {
                // no type-specific fields
            }
        }
    }
    
    private void validateFieldLengths(ChatMessage message) {
        checkLength(message.getSessionId(), MAX_SESSION_ID_LENGTH, "session_id");
        checkLength(message.getContent(), MAX_CONTENT_LENGTH, "content");
        checkLength(message.getFileId(), MAX_FILE_ID_LENGTH, "file_id");
        checkLength(message.getFileUrl(), MAX_FILE_URL_LENGTH, "file_url");
        checkLength(message.getModelId(), MAX_MODEL_ID_LENGTH, "model_id");
        
        Map<String, String> metadata = message.getMetadata();
        if (metadata != null) {
            for (Map.Entry<String, String> entry : metadata.entrySet()) {
                checkLength(entry.getValue(), MAX_METADATA_VALUE_LENGTH, "metadata." + entry.getKey());
            }
        }
    }
    
    private void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw ChatException.missingField(field);
        }
    }
    
    private void checkLength(String value, int max, String field) {
        if (value != null && value.length() > max) {
            throw ChatException.invalidFormat(field + " exceeds maximum length of " + max + " characters");
        }
    }
}
