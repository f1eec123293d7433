package com.demoBank.chatbox.common.exception;

import lombok.Getter;

/**
 * Base exception for every failure that is reported to a client.
 * 
 * The message is client-safe. Anything sensitive belongs in the cause, which is only logged.
 */
@Getter
public class ChatException extends RuntimeException {
    
    private final ErrorCode code;
    
    /**
     * Seconds the client should wait before retrying, or null when not applicable.
     */
    private final Integer retryAfterSeconds;
    
    public ChatException(ErrorCode code) {
        this(code, code.getDefaultMessage(), null, null);
    }
    
    public ChatException(ErrorCode code, String message) {
        this(code, message, null, null);
    }
    
    public ChatException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }
    
    public ChatException(ErrorCode code, String message, Integer retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryAfterSeconds = retryAfterSeconds;
    }
    
    public ErrorCategory getCategory() {
        return code.getCategory();
    }
    
    public boolean isRecoverable() {
        return code.isRecoverable();
    }
    
    public static ChatException invalidFormat(String details) {
        return new ChatException(ErrorCode.INVALID_FORMAT, "Invalid message format: " + details);
    }
    
    public static ChatException invalidFormat(String details, Throwable cause) {
        return new ChatException(ErrorCode.INVALID_FORMAT, "Invalid message format: " + details, cause);
    }
    
    public static ChatException missingField(String fieldName) {
        return new ChatException(ErrorCode.MISSING_FIELD, "Required field missing: " + fieldName);
    }
    
    public static ChatException llmUnavailable(Throwable cause) {
        return new ChatException(ErrorCode.LLM_UNAVAILABLE, ErrorCode.LLM_UNAVAILABLE.getDefaultMessage(), cause);
    }
    
    public static ChatException databaseError(Throwable cause) {
        return new ChatException(ErrorCode.DATABASE_ERROR, ErrorCode.DATABASE_ERROR.getDefaultMessage(), cause);
    }
}
