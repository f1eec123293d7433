package com.demoBank.chatbox.connection;

/**
 * Thrown when work arrives for a connection that has already been closed.
 */
public class ConnectionClosedException extends IllegalStateException {
    
    private final String connectionId;
    
    public ConnectionClosedException(String connectionId) {
        super("Connection is closed: " + connectionId);
        this.connectionId = connectionId;
    }
    
    public String getConnectionId() {
        return connectionId;
    }
}
