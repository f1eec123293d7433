package com.demoBank.chatbox.session;

import com.demoBank.chatbox.message.SenderType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A message as kept in the session history.
 */
@Value
@Builder
public class SessionMessage {
    String id;
    String content;
    SenderType sender;
    Instant timestamp;
    String fileId;
    String fileUrl;
    Map<String, String> metadata;
}
