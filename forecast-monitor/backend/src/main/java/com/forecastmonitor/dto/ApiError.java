package com.forecastmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body of every failed {@code /api} call. {@code errorCode} is the stable machine-readable
 * code; {@code requestId} matches the {@code X-Request-ID} response header.
 */
@Value
@Builder
@JsonPropertyOrder({"errorCode", "status", "error", "message", "path", "requestId", "timestamp", "violations"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiError {
    String errorCode;
    int status;
    String error;
    String message;
    String path;
    String requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
    @Singular
    List<Violation> violations;

    public static ApiErrorBuilder of(HttpStatus status, String errorCode, String message) {
        return builder()
            .status(status.value())
            .error(status.getReasonPhrase())
            .errorCode(errorCode)
            .message(message);
    }

    /** A rejected request field or parameter. */
    @Value
    public static class Violation {
        String target;
        Object rejectedValue;
        String message;
    }
}
