package com.nosota.mpayout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.MDC;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Error body returned for every rejected request.
 *
 * @param details Structured detail for the caller (wait time, balance shortfall, failing field...)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId,
        Map<String, Object> details
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return of(status, error, message, path, Map.of());
    }

    public static ErrorResponse of(int status, String error, String message, String path,
                                   Map<String, Object> details) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path, MDC.get("correlationId"), details);
    }
}
