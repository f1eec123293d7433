package com.demoBank.chatbox.ratelimit;

import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;

/**
 * Thrown when a key has used up its request budget for the current window.
 */
public class RateLimitExceededException extends ChatException {
    
    public RateLimitExceededException(int retryAfterSeconds) {
        super(ErrorCode.TOO_MANY_REQUESTS, ErrorCode.TOO_MANY_REQUESTS.getDefaultMessage(), retryAfterSeconds, null);
    }
}
