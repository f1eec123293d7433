package com.demoBank.chatbox.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SenderType {
    USER("user"),
    AI("ai"),
    ADMIN("admin"),
    SYSTEM("system");
    
    private final String value;
    
    SenderType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static SenderType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SenderType sender : values()) {
            if (sender.value.equals(value)) {
                return sender;
            }
        }
        throw new IllegalArgumentException("Unknown sender: " + value);
    }
}
