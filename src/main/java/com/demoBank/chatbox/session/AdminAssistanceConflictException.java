package com.demoBank.chatbox.session;

import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;

/**
 * Thrown when an admin tries to take over (or release) a session they cannot.
 */
public class AdminAssistanceConflictException extends ChatException {
    
    public AdminAssistanceConflictException(String message) {
        super(ErrorCode.ADMIN_ALREADY_ASSISTING, message);
    }
}
