package com.demoBank.chatbox.session;

import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;

/**
 * Thrown when a user refers to a session owned by someone else.
 * The client only sees a generic denial; the owner is never disclosed.
 */
public class SessionOwnershipException extends ChatException {
    
    public SessionOwnershipException() {
        super(ErrorCode.SESSION_ACCESS_DENIED);
    }
}
