package com.demoBank.chatbox.auth;

import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;

/**
 * Thrown when a bearer token is missing, malformed, expired or fails signature checks.
 */
public class UnauthorizedException extends ChatException {
    
    public UnauthorizedException(ErrorCode code, String message) {
        super(code, message);
    }
    
    public UnauthorizedException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
