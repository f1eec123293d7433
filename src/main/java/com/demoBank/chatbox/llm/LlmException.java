package com.demoBank.chatbox.llm;

/**
 * Failure talking to the LLM provider. The message may contain provider details and is never sent to clients.
 */
public class LlmException extends RuntimeException {
    
    public LlmException(String message) {
        super(message);
    }
    
    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
