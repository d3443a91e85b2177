package com.expensesnap.core.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to {@code {"error": kind, "message": detail, "status": code}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ExpenseSnapException.class)
    public ResponseEntity<Map<String, Object>> handleExpenseSnap(ExpenseSnapException ex) {
        HttpStatus status = ex.getKind().getStatus();
        if (status.is5xxServerError()) {
            log.error("{}: {}", ex.getKind(), ex.getMessage(), ex);
        } else {
            log.warn("{}: {}", ex.getKind(), ex.getMessage());
        }
        return body(status, ex.getKind().name(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + " " + ex.getBindingResult().getFieldError(field).getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR.name(),
                message.isEmpty() ? "Request validation failed" : message);
    }

    @ExceptionHandler({MissingServletRequestPartException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        String message = ex instanceof MissingServletRequestPartException ? "No file uploaded" : "Malformed request";
        return body(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR.name(), message);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(MaxUploadSizeExceededException ex) {
        return body(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR.name(), "File exceeds the upload size limit");
    }

    @ExceptionHandler(org.springframework.security.access.AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleSpringAccessDenied(
            org.springframework.security.access.AccessDeniedException ex) {
        return body(HttpStatus.FORBIDDEN, ErrorKind.ACCESS_DENIED.name(), "Access denied");
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected server error");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error);
        payload.put("message", message);
        payload.put("status", status.value());
        return ResponseEntity.status(status).body(payload);
    }
}
