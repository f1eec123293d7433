package com.demoBank.chatbox.common.exception;

import lombok.Getter;

/**
 * Stable error codes sent to clients. Messages are generic on purpose; details only go to the server log.
 */
@Getter
public enum ErrorCode {
    
    // auth
    INVALID_TOKEN(ErrorCategory.AUTH, false, "Invalid authentication token"),
    EXPIRED_TOKEN(ErrorCategory.AUTH, false, "Authentication token has expired"),
    INSUFFICIENT_PERMISSIONS(ErrorCategory.AUTH, true, "Insufficient permissions for this operation"),
    SESSION_ACCESS_DENIED(ErrorCategory.AUTH, true, "Access to this session is denied"),
    
    // validation
    INVALID_FORMAT(ErrorCategory.VALIDATION, true, "Invalid message format"),
    MISSING_FIELD(ErrorCategory.VALIDATION, true, "Required field missing"),
    UNKNOWN_MODEL(ErrorCategory.VALIDATION, true, "Unknown model"),
    SESSION_NOT_FOUND(ErrorCategory.VALIDATION, true, "Session not found"),
    
    // conflict
    ADMIN_ALREADY_ASSISTING(ErrorCategory.CONFLICT, true, "Session is already assisted by an admin"),
    
    // service
    LLM_UNAVAILABLE(ErrorCategory.SERVICE, true, "AI service is temporarily unavailable"),
    DATABASE_ERROR(ErrorCategory.SERVICE, true, "Database operation failed"),
    STORAGE_ERROR(ErrorCategory.SERVICE, true, "File storage operation failed"),
    SERVICE_ERROR(ErrorCategory.SERVICE, true, "Service error"),
    
    // rate limit
    TOO_MANY_REQUESTS(ErrorCategory.RATE_LIMIT, true, "Too many requests, please slow down"),
    CONNECTION_LIMIT_EXCEEDED(ErrorCategory.RATE_LIMIT, true, "Connection limit exceeded, please try again later");
    
    private final ErrorCategory category;
    private final boolean recoverable;
    private final String defaultMessage;
    
    ErrorCode(ErrorCategory category, boolean recoverable, String defaultMessage) {
        this.category = category;
        this.recoverable = recoverable;
        this.defaultMessage = defaultMessage;
    }
}
