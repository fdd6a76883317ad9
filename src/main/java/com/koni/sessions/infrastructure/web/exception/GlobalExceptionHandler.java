package com.koni.sessions.infrastructure.web.exception;

import com.koni.sessions.application.command.IngestSessionEventResponse;
import com.koni.sessions.domain.exception.SessionIngestionException;
import com.koni.sessions.domain.exception.SessionNotFoundException;
import com.koni.sessions.domain.exception.ValidationException;
import com.koni.sessions.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for REST API endpoints.
 * Provides consistent error responses and appropriate HTTP status codes.
 *
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle validation exceptions.
     * Returns 400 Bad Request with every violation found.
     *
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        ErrorResponse errorResponse = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            ex.getMessage(),
            ex.getErrors()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * Handle request bodies that are not valid JSON or carry values of the wrong type.
     * Returns 400 Bad Request.
     *
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        ErrorResponse errorResponse = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "Malformed request body"
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * Handle unknown sessions.
     * Returns 404 Not Found.
     *
     */
    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFoundException(SessionNotFoundException ex) {
        log.info("Session not found: {}", ex.getMessage());
        ErrorResponse errorResponse = new ErrorResponse(
            HttpStatus.NOT_FOUND.value(),
            ex.getMessage()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * Handle ingestion failures.
     * Returns 500 with the same body a retry of the request will replay from the idempotency ledger.
     *
     */
    @ExceptionHandler(SessionIngestionException.class)
    public ResponseEntity<IngestSessionEventResponse> handleSessionIngestionException(SessionIngestionException ex) {
        log.error("Ingestion failed: idempotencyKey={}, sessionId={}",
            ex.getIdempotencyKey(), ex.getSessionId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(IngestSessionEventResponse.failure(ex.getMessage()));
    }

    /**
     * Handle all other unexpected exceptions.
     * Returns 500 Internal Server Error for unhandled exceptions.
     *
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        ErrorResponse errorResponse = new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "Internal server error"
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}
