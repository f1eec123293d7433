package com.demoBank.chatbox.message;

import com.demoBank.chatbox.common.exception.ChatException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error payload of an {@code error} frame.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorInfo {
    
    @JsonProperty("code")
    private String code;
    
    @JsonProperty("message")
    private String message;
    
    @JsonProperty("recoverable")
    private boolean recoverable;
    
    /**
     * Seconds to wait before retrying. Only set for rate-limit errors.
     */
    @JsonProperty("retry_after")
    private Integer retryAfter;
    
    public static ErrorInfo from(ChatException ex) {
        return ErrorInfo.builder()
                .code(ex.getCode().name())
                .message(ex.getMessage())
                .recoverable(ex.isRecoverable())
                .retryAfter(ex.getRetryAfterSeconds())
                .build();
    }
}
