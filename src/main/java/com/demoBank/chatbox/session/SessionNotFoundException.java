package com.demoBank.chatbox.session;

import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;

public class SessionNotFoundException extends ChatException {
    
    private final String sessionId;
    
    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND);
        this.sessionId = sessionId;
    }
    
    public String getSessionId() {
        return sessionId;
    }
}
