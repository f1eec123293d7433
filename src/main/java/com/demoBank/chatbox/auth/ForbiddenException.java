package com.demoBank.chatbox.auth;

import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;

public class ForbiddenException extends ChatException {
    
    public ForbiddenException() {
        super(ErrorCode.INSUFFICIENT_PERMISSIONS);
    }
}
