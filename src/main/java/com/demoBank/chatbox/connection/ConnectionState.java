package com.demoBank.chatbox.connection;

/**
 * Lifecycle of a client connection. Transitions only move forward.
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATED,
    ACTIVE,
    CLOSING,
    CLOSED
}
