package eu.virtualparadox.lobbymap.web;

import eu.virtualparadox.lobbymap.exception.DocumentParseException;
import eu.virtualparadox.lobbymap.exception.DuplicateInsertException;
import eu.virtualparadox.lobbymap.exception.ExternalServiceException;
import eu.virtualparadox.lobbymap.exception.ExternalServiceTimeoutException;
import eu.virtualparadox.lobbymap.exception.IndexUnavailableException;
import eu.virtualparadox.lobbymap.exception.IngestionFailedException;
import eu.virtualparadox.lobbymap.exception.IngestionRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.concurrent.CancellationException;

/**
 * Maps domain failures to HTTP statuses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IngestionFailedException.class)
    public ResponseEntity<ErrorResponse> handleIngestionFailed(IngestionFailedException e) {
        log.error("Ingestion failed: document={}, stage={}, cause={}", e.getDocumentId(), e.getStage(), e.getMessage());
        final HttpStatus status;
        if (e.isTransient()) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else if (e.getCause() instanceof DocumentParseException) {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse("INGESTION_FAILED_" + e.getStage(), e.getMessage()));
    }

    @ExceptionHandler(IngestionRejectedException.class)
    public ResponseEntity<ErrorResponse> handleIngestionRejected(IngestionRejectedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("INGESTION_REJECTED", e.getMessage()));
    }

    @ExceptionHandler(DuplicateInsertException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateInsert(DuplicateInsertException e) {
        log.error("Concurrent insert bypassed the document lock: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("DUPLICATE_INSERT", e.getMessage()));
    }

    @ExceptionHandler({IndexUnavailableException.class, ExternalServiceTimeoutException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException e) {
        log.error("Dependency unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("SERVICE_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<ErrorResponse> handleExternal(ExternalServiceException e) {
        log.error("Model call failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("MODEL_ERROR", e.getMessage()));
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(CancellationException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("CANCELLED", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleIllegalArgument(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error"));
    }
}
