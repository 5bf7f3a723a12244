package com.herzen.progress.api;

import com.herzen.progress.domain.ProgressEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ProgressEngineException.class)
    public ResponseEntity<ErrorResponse> handle(ProgressEngineException e) {
        HttpStatus status = switch (e.kind()) {
            case LESSON_NOT_FOUND, SUBJECT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STRUCTURE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case CACHE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case SYNC_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.kind(), e.getMessage(), e);
        } else {
            log.debug("Rejected request with {}: {}", e.kind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.kind().name(), e.getMessage(), e.retryable()));
    }

    public record ErrorResponse(String code, String message, boolean retryable) {}
}
