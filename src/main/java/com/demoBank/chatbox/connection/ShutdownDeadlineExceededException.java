package com.demoBank.chatbox.connection;

import java.util.List;

/**
 * Thrown when connections are still open after the shutdown deadline.
 * Close has been initiated on every connection regardless.
 */
public class ShutdownDeadlineExceededException extends RuntimeException {
    
    private final List<String> openConnectionIds;
    
    public ShutdownDeadlineExceededException(List<String> openConnectionIds) {
        super("Shutdown deadline exceeded with " + openConnectionIds.size() + " connection(s) still open");
        this.openConnectionIds = List.copyOf(openConnectionIds);
    }
    
    public List<String> getOpenConnectionIds() {
        return openConnectionIds;
    }
}
