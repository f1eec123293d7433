package com.demoBank.chatbox.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wire value of the {@code type} field.
 * Values the server does not know map to {@link #UNKNOWN} so that they can be answered with an error frame.
 */
public enum MessageType {
    USER_MESSAGE("user_message"),
    AI_RESPONSE("ai_response"),
    FILE_UPLOAD("file_upload"),
    VOICE_MESSAGE("voice_message"),
    HELP_REQUEST("help_request"),
    MODEL_SELECT("model_select"),
    ADMIN_TAKEOVER("admin_takeover"),
    ADMIN_LEAVE("admin_leave"),
    LOADING("loading"),
    CONNECTION_STATUS("connection_status"),
    ERROR("error"),
    UNKNOWN("unknown");
    
    private final String value;
    
    MessageType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static MessageType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (MessageType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
