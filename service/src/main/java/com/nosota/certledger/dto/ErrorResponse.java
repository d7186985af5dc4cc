package com.nosota.certledger.dto;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Error body returned by {@link com.nosota.certledger.exception.GlobalExceptionHandler}.
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path
) {
    public static ErrorResponse of(Clock clock, int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(clock), status, error, message, path);
    }
}
