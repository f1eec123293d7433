package com.demoBank.chatbox.storage;

import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;

/**
 * Persistence failure. Transient failures (timeouts, lost connection) may succeed on a later attempt.
 */
public class StorageException extends ChatException {
    
    private final boolean transientFailure;
    
    public StorageException(String message, boolean transientFailure, Throwable cause) {
        super(ErrorCode.DATABASE_ERROR, message, cause);
        this.transientFailure = transientFailure;
    }
    
    public boolean isTransient() {
        return transientFailure;
    }
}
