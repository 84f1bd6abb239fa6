package com.example.boundary.common.exception;

import com.example.boundary.audit.exception.AuditWriteException;
import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.context.exception.ContextNotFoundException;
import com.example.boundary.context.exception.TransientStorageException;
import com.example.boundary.identity.exception.AuthorizationException;
import com.example.boundary.query.exception.ExternalServiceException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Response bodies never carry exception messages from the domain layer, since those may name
 * resources. Logged values go through {@link StringSanitizer}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 100;

    /**
     * Audit trail unavailable. The operation was not completed.
     */
    @ExceptionHandler(AuditWriteException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAuditWrite(@NonNull AuditWriteException ex) {
        LOG.error("Audit write failure: {}", StringSanitizer.forLog(ex.getMessage()));
        return error(HttpStatus.SERVICE_UNAVAILABLE, "audit_unavailable",
                "Audit trail unavailable. Please try again later.");
    }

    @ExceptionHandler(TransientStorageException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleTransientStorage(@NonNull TransientStorageException ex) {
        LOG.error("Context store unavailable: {}", StringSanitizer.forLog(ex.getMessage()));
        return error(HttpStatus.SERVICE_UNAVAILABLE, "storage_unavailable",
                "Context store unavailable. Please try again later.");
    }

    @ExceptionHandler(ExternalServiceException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleExternalService(@NonNull ExternalServiceException ex) {
        LOG.error("External service error: service={}, status={}",
                ex.getServiceName(), ex.getStatusCode());
        return error(HttpStatus.BAD_GATEWAY, "external_service_error", "External service unavailable");
    }

    @ExceptionHandler(AuthorizationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAuthorization(@NonNull AuthorizationException ex) {
        LOG.warn("Access denied: {}", StringSanitizer.forLog(ex.getReasonCode()));
        Map<String, Object> body = new HashMap<>();
        body.put("error", "access_denied");
        body.put("code", ex.getReasonCode());
        body.put("message", "Access denied");
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
    }

    @ExceptionHandler(ContextNotFoundException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleNotFound(@NonNull ContextNotFoundException ex) {
        LOG.info("Not found: {}", ex.getResourceType());
        return error(HttpStatus.NOT_FOUND, "not_found", "Resource not found");
    }

    /**
     * Handles validation errors from @Valid annotated request bodies.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleValidationErrors(@NonNull WebExchangeBindException ex) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", sanitizeFieldName(error.getField()),
                        "message", sanitizeResponseMessage(error.getDefaultMessage())))
                .toList();

        return validationError(fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(@NonNull ConstraintViolationException ex) {
        LOG.warn("Constraint violation: {} violations", ex.getConstraintViolations().size());

        List<Map<String, String>> violations = ex.getConstraintViolations().stream()
                .map(violation -> Map.of(
                        "field", sanitizeFieldName(extractFieldName(violation)),
                        "message", sanitizeResponseMessage(violation.getMessage())))
                .toList();

        return validationError(violations);
    }

    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", StringSanitizer.forLog(ex.getReason()));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", "Invalid request format");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(@NonNull IllegalArgumentException ex) {
        LOG.warn("Illegal argument: {}", StringSanitizer.forLog(ex.getMessage()));
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", "Invalid request parameter");
    }

    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", StringSanitizer.forLog(ex.getMessage()), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", error,
                        "message", message,
                        "timestamp", Instant.now().toString()
                ));
    }

    private static ResponseEntity<Map<String, Object>> validationError(List<Map<String, String>> details) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("message", "Request validation failed");
        response.put("details", details);
        response.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @NonNull
    private static String extractFieldName(@NonNull ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @NonNull
    private static String sanitizeFieldName(@Nullable String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return "unknown";
        }
        String cleaned = fieldName.replaceAll("[^a-zA-Z0-9._]", "");
        return cleaned.substring(0, Math.min(cleaned.length(), 50));
    }

    @NonNull
    private static String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message
                .replace("\n", " ")
                .replace("\r", " ")
                .replace("\t", " ");

        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
