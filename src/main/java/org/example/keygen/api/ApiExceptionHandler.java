package org.example.keygen.api;

import org.example.keygen.deadletter.DeadLetterMonitorUnavailableException;
import org.example.keygen.model.InvalidKeySpecRequestException;
import org.example.keygen.queue.JobEnqueueException;
import org.example.keygen.result.ResultNotFoundException;
import org.example.keygen.store.ResultStoreException;
import org.example.keygen.submission.RequestIdExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to {@code {"error": ...}} responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidKeySpecRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidKeySpec(InvalidKeySpecRequestException ex) {
        logger.warn("Rejected keygen request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid request body"));
    }

    @ExceptionHandler(ResultNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResultNotFoundException ex) {
        logger.debug("Result lookup missed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("not found", ex.getRequestId()));
    }

    // The record was written but the job never reached the queue
    @ExceptionHandler(JobEnqueueException.class)
    public ResponseEntity<ErrorResponse> handleEnqueueFailure(JobEnqueueException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("Failed to enqueue job, please resubmit", ex.getRequestId()));
    }

    @ExceptionHandler({ResultStoreException.class, RequestIdExhaustedException.class})
    public ResponseEntity<ErrorResponse> handleStoreFailure(RuntimeException ex) {
        logger.error("Result store failure", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of("Result store unavailable"));
    }

    @ExceptionHandler(DeadLetterMonitorUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleMonitorUnavailable(DeadLetterMonitorUnavailableException ex) {
        logger.warn("Dead-letter query failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of(ex.getMessage()));
    }
}
