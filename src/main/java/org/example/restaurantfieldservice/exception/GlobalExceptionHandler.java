package org.example.restaurantfieldservice.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions thrown by the REST layer to {@link ErrorResponse} bodies.
 *
 * <ul>
 *   <li>{@link ResourceNotFoundException} - 404</li>
 *   <li>{@link InvalidTicketOperationException}, {@link TicketNotAssignedException},
 *       {@link NullRequestException}, validation errors - 400</li>
 *   <li>{@link AuthenticationException} - 401</li>
 *   <li>{@link PermissionDeniedException} - 403</li>
 *   <li>{@link DuplicateResourceException} - 409</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice(basePackages = "org.example.restaurantfieldservice")
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler {

    // ==================== SPRING MVC EXCEPTIONS ====================

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, WebRequest request) {
        log.error("❌ HTTP MESSAGE NOT READABLE - {}", ex.getMessage());
        String message = ex.getMessage() != null && ex.getMessage().contains("Required request body is missing")
                ? "Request body is required."
                : "Invalid request body. Please provide valid JSON.";
        return build(HttpStatus.BAD_REQUEST, "Bad Request", message, null, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, WebRequest request) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
            fieldErrors.putIfAbsent(fieldName, error.getDefaultMessage());
        });

        String message = "Validation failed: " + fieldErrors.entrySet().stream()
                .map(e -> e.getKey() + " - " + e.getValue())
                .collect(Collectors.joining("; "));
        log.warn("❌ VALIDATION FAILED - {}", message);
        return build(HttpStatus.BAD_REQUEST, "Validation Error", message, null, request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, WebRequest request) {
        log.warn("❌ MISSING PARAMETER - {}", ex.getMessage());
        String message = String.format("Required parameter '%s' of type '%s' is missing",
                ex.getParameterName(), ex.getParameterType());
        return build(HttpStatus.BAD_REQUEST, "Missing Parameter", message, null, request);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(
            MissingRequestHeaderException ex, WebRequest request) {
        log.warn("❌ MISSING HEADER - {}", ex.getHeaderName());
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized",
                "Missing required header: " + ex.getHeaderName(), null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, WebRequest request) {
        log.warn("❌ TYPE MISMATCH - {}", ex.getMessage());
        String message = String.format("Parameter '%s' should be of type '%s' but received '%s'",
                ex.getName(),
                ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown",
                ex.getValue());
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", message, null, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, WebRequest request) {
        log.warn("❌ METHOD NOT ALLOWED - {}", ex.getMessage());
        String message = String.format("HTTP method '%s' is not supported for this endpoint. Supported methods: %s",
                ex.getMethod(), ex.getSupportedHttpMethods());
        return build(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", message, null, request);
    }

    // ==================== BUSINESS EXCEPTIONS ====================

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, WebRequest request) {
        log.warn("⚠️ NOT FOUND - {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateResourceException ex, WebRequest request) {
        log.warn("⚠️ DUPLICATE - {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Duplicate Resource", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(TicketNotAssignedException.class)
    public ResponseEntity<ErrorResponse> handleNotAssigned(TicketNotAssignedException ex, WebRequest request) {
        log.warn("⚠️ TICKET NOT ASSIGNED - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Ticket Not Assigned", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(InvalidTicketOperationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOperation(
            InvalidTicketOperationException ex, WebRequest request) {
        log.warn("❌ INVALID OPERATION - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Operation", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDenied(PermissionDeniedException ex, WebRequest request) {
        log.warn("⛔ PERMISSION DENIED - {}", ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "Permission Denied", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(AuthenticationException ex, WebRequest request) {
        log.warn("⛔ UNAUTHORIZED - {}", ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(NullRequestException.class)
    public ResponseEntity<ErrorResponse> handleNullRequest(NullRequestException ex, WebRequest request) {
        log.warn("❌ NULL REQUEST - Field: {}, Message: {}", ex.getField(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Null Request", ex.getMessage(), ex.getErrorCode(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        log.warn("❌ ILLEGAL ARGUMENT - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), null, request);
    }

    // ==================== SYSTEM EXCEPTIONS ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex, WebRequest request) {
        log.error("💥 UNHANDLED EXCEPTION - {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", null, request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                String errorCode, WebRequest request) {
        ErrorResponse body = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getDescription(false),
                errorCode
        );
        return new ResponseEntity<>(body, status);
    }
}
