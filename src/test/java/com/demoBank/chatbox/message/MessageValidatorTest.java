package com.demoBank.chatbox.message;

import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageValidatorTest {

    private MessageValidator validator;

    @BeforeEach
    void setUp() {
        validator = new MessageValidator();
    }

    @Test
    @DisplayName("Missing timestamp and sender are defaulted")
    void validate_appliesDefaults() {
        ChatMessage message = ChatMessage.builder().type(MessageType.USER_MESSAGE).content("hi").build();

        validator.validate(message);

        assertThat(message.getTimestamp()).isNotNull();
        assertThat(message.getSender()).isEqualTo(SenderType.USER);
    }

    @Test
    @DisplayName("Missing type is a missing field")
    void validate_missingType() {
        ChatMessage message = ChatMessage.builder().content("hi").build();

        assertThatThrownBy(() -> validator.validate(message))
                .isInstanceOf(ChatException.class)
                .extracting(e -> ((ChatException) e).getCode())
                .isEqualTo(ErrorCode.MISSING_FIELD);
    }

    @Test
    @DisplayName("Unknown type is an invalid format")
    void validate_unknownType() {
        ChatMessage message = ChatMessage.builder().type(MessageType.UNKNOWN).build();

        assertThatThrownBy(() -> validator.validate(message))
                .isInstanceOf(ChatException.class)
                .extracting(e -> ((ChatException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_FORMAT);
    }

    @Test
    @DisplayName("Type-specific fields are required")
    void validate_typeSpecificFields() {
        assertMissing(ChatMessage.builder().type(MessageType.USER_MESSAGE).content(" ").build());
        assertMissing(ChatMessage.builder().type(MessageType.FILE_UPLOAD).fileId("f1").build());
        assertMissing(ChatMessage.builder().type(MessageType.VOICE_MESSAGE).fileUrl("https://cdn/x.ogg").build());
        assertMissing(ChatMessage.builder().type(MessageType.MODEL_SELECT).build());
        assertMissing(ChatMessage.builder().type(MessageType.ADMIN_TAKEOVER).build());
        assertMissing(ChatMessage.builder().type(MessageType.ADMIN_LEAVE).build());
    }

    @Test
    @DisplayName("Over-long fields are rejected")
    void validate_fieldLengths() {
        assertInvalid(ChatMessage.builder().type(MessageType.USER_MESSAGE)
                .content("a".repeat(MessageValidator.MAX_CONTENT_LENGTH + 1)).build());
        assertInvalid(ChatMessage.builder().type(MessageType.USER_MESSAGE).content("hi")
                .sessionId("s".repeat(MessageValidator.MAX_SESSION_ID_LENGTH + 1)).build());
        assertInvalid(ChatMessage.builder().type(MessageType.USER_MESSAGE).content("hi")
                .metadata(Map.of("note", "m".repeat(MessageValidator.MAX_METADATA_VALUE_LENGTH + 1))).build());
        assertInvalid(ChatMessage.builder().type(MessageType.MODEL_SELECT)
                .modelId("x".repeat(MessageValidator.MAX_MODEL_ID_LENGTH + 1)).build());
    }

    @Test
    @DisplayName("Content at the maximum length is accepted")
    void validate_contentAtLimit() {
        ChatMessage message = ChatMessage.builder().type(MessageType.USER_MESSAGE)
                .content("a".repeat(MessageValidator.MAX_CONTENT_LENGTH)).build();

        validator.validate(message);

        assertThat(message.getContent()).hasSize(MessageValidator.MAX_CONTENT_LENGTH);
    }

    @Test
    @DisplayName("Timestamp far in the future is rejected, small skew is tolerated")
    void validate_futureTimestamp() {
        assertInvalid(ChatMessage.builder().type(MessageType.USER_MESSAGE).content("hi")
                .timestamp(Instant.now().plus(Duration.ofMinutes(5))).build());

        ChatMessage skewed = ChatMessage.builder().type(MessageType.USER_MESSAGE).content("hi")
                .timestamp(Instant.now().plusSeconds(20)).build();
        validator.validate(skewed);
    }

    private void assertMissing(ChatMessage message) {
        assertThatThrownBy(() -> validator.validate(message))
                .isInstanceOf(ChatException.class)
                .extracting(e -> ((ChatException) e).getCode())
                .isEqualTo(ErrorCode.MISSING_FIELD);
    }

    private void assertInvalid(ChatMessage message) {
        assertThatThrownBy(() -> validator.validate(message))
                .isInstanceOf(ChatException.class)
                .extracting(e -> ((ChatException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_FORMAT);
    }
}
