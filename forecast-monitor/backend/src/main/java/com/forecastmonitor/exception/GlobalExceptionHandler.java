package com.forecastmonitor.exception;

import com.forecastmonitor.config.RequestIdFilter;
import com.forecastmonitor.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.Violation> violations = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> new ApiError.Violation(fe.getField(), fe.getRejectedValue(), fe.getDefaultMessage()))
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED",
                     "One or more fields failed validation", request, violations);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiError.Violation> violations = ex.getConstraintViolations().stream()
            .map(v -> new ApiError.Violation(v.getPropertyPath().toString(), v.getInvalidValue(), v.getMessage()))
            .toList();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED",
                     "One or more parameters failed validation", request, violations);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "TYPE_MISMATCH", msg, request, List.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST",
                     "Request body could not be read", request, List.of());
    }

    @ExceptionHandler({ForecastNotFoundException.class, ModelNotFoundException.class, TaskNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            ForecastMonitorException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler(DuplicateOutcomeException.class)
    public ResponseEntity<ApiError> handleDuplicate(
            DuplicateOutcomeException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, ex, request);
    }

    @ExceptionHandler({InsufficientDataException.class, InvalidSeriesException.class,
                       DateNotPredictedException.class, InvalidRequestException.class})
    public ResponseEntity<ApiError> handleUnprocessable(
            ForecastMonitorException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex, request);
    }

    @ExceptionHandler(NotificationDeliveryException.class)
    public ResponseEntity<ApiError> handleDelivery(
            NotificationDeliveryException ex, HttpServletRequest request) {
        log.error("Notification delivery failed: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                     "An unexpected error occurred", request, List.of());
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, ForecastMonitorException ex, HttpServletRequest request) {
        return build(status, ex.getErrorCode(), ex.getMessage(), request, List.of());
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String errorCode, String message,
            HttpServletRequest request, List<ApiError.Violation> violations) {

        ApiError body = ApiError.of(status, errorCode, message)
            .path(request.getRequestURI())
            .requestId(RequestIdFilter.resolveRequestId(request))
            .timestamp(Instant.now())
            .violations(violations)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
