package com.demoBank.chatbox.admin;

import com.demoBank.chatbox.common.exception.ChatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the HTTP routes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<ErrorResponse> handleChatException(ChatException ex) {
        HttpStatus status = statusOf(ex);
        switch (ex.getCategory()) {
            case SERVICE -> log.error("Request failed - code: {}", ex.getCode(), ex);
            case RATE_LIMIT -> log.debug("Request rate limited - code: {}", ex.getCode());
            default -> log.warn("Request rejected - code: {}, status: {}", ex.getCode(), status.value());
        }

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (ex.getRetryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, ex.getRetryAfterSeconds())));
        }
        return response.body(new ErrorResponse(ex.getCode().name(), clientMessage(ex, status)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    static HttpStatus statusOf(ChatException ex) {
        return switch (ex.getCode()) {
            case INVALID_TOKEN, EXPIRED_TOKEN -> HttpStatus.UNAUTHORIZED;
            case INSUFFICIENT_PERMISSIONS, SESSION_ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_FORMAT, MISSING_FIELD, UNKNOWN_MODEL -> HttpStatus.BAD_REQUEST;
            case ADMIN_ALREADY_ASSISTING -> HttpStatus.CONFLICT;
            case TOO_MANY_REQUESTS, CONNECTION_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case LLM_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case DATABASE_ERROR, STORAGE_ERROR, SERVICE_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    // auth failures never say why
    private static String clientMessage(ChatException ex, HttpStatus status) {
        return switch (status) {
            case UNAUTHORIZED -> "Unauthorized";
            case FORBIDDEN -> "Forbidden";
            default -> ex.getMessage();
        };
    }

    record ErrorResponse(String code, String message) {}
}
