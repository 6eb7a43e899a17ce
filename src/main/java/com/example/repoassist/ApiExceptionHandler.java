package com.example.repoassist;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions escaping the controllers to a JSON error body. Insufficient evidence and failed
 * requests are not exceptions: they come back as a normal envelope.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<QueryModels.ErrorResponse> handleSessionNotFound(SessionNotFoundException ex) {
        log.warn("[API] {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<QueryModels.ErrorResponse> handleIngestion(IngestionException ex) {
        log.warn("[API] Ingestion failed: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "INGESTION_FAILED", ex.getMessage());
    }

    @ExceptionHandler(CitationStaleException.class)
    public ResponseEntity<QueryModels.ErrorResponse> handleStale(CitationStaleException ex) {
        log.warn("[API] {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ErrorKind.CITATION_STALE.name(), ex.getMessage());
    }

    @ExceptionHandler(EvidenceNotFoundException.class)
    public ResponseEntity<QueryModels.ErrorResponse> handleEvidenceNotFound(EvidenceNotFoundException ex) {
        log.warn("[API] {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "EVIDENCE_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<QueryModels.ErrorResponse> handleBadRequest(Exception ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<QueryModels.ErrorResponse> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", "Internal server error");
    }

    private static ResponseEntity<QueryModels.ErrorResponse> error(HttpStatus status, String kind, String message) {
        return ResponseEntity.status(status).body(new QueryModels.ErrorResponse(status.value(), kind, message));
    }
}
