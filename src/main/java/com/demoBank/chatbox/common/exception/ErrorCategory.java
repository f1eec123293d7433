package com.demoBank.chatbox.common.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Broad classes of failure. Auth failures end the connection; the rest are reported and the connection stays open.
 */
public enum ErrorCategory {
    AUTH("auth"),
    VALIDATION("validation"),
    CONFLICT("conflict"),
    RATE_LIMIT("rate_limit"),
    SERVICE("service");
    
    private final String value;
    
    ErrorCategory(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
