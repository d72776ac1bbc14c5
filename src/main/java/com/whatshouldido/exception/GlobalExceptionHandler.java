package com.whatshouldido.exception;

import com.whatshouldido.dto.response.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex, HttpServletRequest request) {
        log.info("Validation failed: {} - Path: {}", ex.getErrors(), request.getRequestURI());

        ErrorResponse response = ErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("One or more fields have invalid values")
                .errorCode(ex.getErrorCode())
                .path(request.getRequestURI())
                .timestamp(java.time.LocalDateTime.now())
                .errors(ex.getErrors())
                .build();

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ErrorResponse> handleQuotaExceededException(
            QuotaExceededException ex, HttpServletRequest request) {
        log.warn("Quota exhausted for user {} - Path: {}", ex.getUserId(), request.getRequestURI());

        Map<String, Object> extensions = new LinkedHashMap<>();
        extensions.put("remaining", ex.getRemaining());
        extensions.put("limit", ex.getLimit());
        extensions.put("upgradeUrl", "/api/subscription/upgrade");

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.FORBIDDEN.value(),
                "Quota Exhausted",
                ex.getMessage(),
                ex.getErrorCode(),
                request.getRequestURI()
        );
        response.setExtensions(extensions);

        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .header("X-Quota-Remaining", String.valueOf(ex.getRemaining()))
                .header("X-Quota-Limit", String.valueOf(ex.getLimit()))
                .body(response);
    }

    @ExceptionHandler(CollaboratorFailureException.class)
    public ResponseEntity<ErrorResponse> handleCollaboratorFailure(
            CollaboratorFailureException ex, HttpServletRequest request) {
        log.error("Collaborator {} failed: {} - Path: {}", ex.getCollaborator(), ex.getMessage(),
                request.getRequestURI(), ex);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.SERVICE_UNAVAILABLE.value(),
                "Service Unavailable",
                ex.getMessage(),
                ex.getErrorCode(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.info("Unreadable request body - Path: {}", request.getRequestURI());

        ErrorResponse response = ErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("Request body is malformed")
                .errorCode(ValidationException.ERROR_CODE)
                .path(request.getRequestURI())
                .timestamp(java.time.LocalDateTime.now())
                .errors(List.of("Request body could not be parsed"))
                .build();

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Illegal argument: {} - Path: {}", ex.getMessage(), request.getRequestURI());

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Bad Request",
                ex.getMessage(),
                "INVALID_ARGUMENT",
                request.getRequestURI()
        );

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error: {} - Path: {}", ex.getMessage(), request.getRequestURI(), ex);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                "INTERNAL_ERROR",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
