package com.csd.updateserver.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps failures to client-facing responses. Only not-found and bad-input are distinguished;
 * everything else is a generic server failure.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AppNotFoundException.class)
    public ResponseEntity<String> handleNotFound(AppNotFoundException ex) {
        log.info("{}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Not found");
    }

    @ExceptionHandler(InvalidVersionException.class)
    public ResponseEntity<String> handleInvalidVersion(InvalidVersionException ex) {
        log.info("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body("Invalid version format");
    }

    @ExceptionHandler(CorruptAssetException.class)
    public ResponseEntity<String> handleCorruptAsset(CorruptAssetException ex) {
        log.error("{}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body("File is corrupted. Please contact administrator.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleException(Exception ex) {
        log.error("Request failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body("Internal server error");
    }
}
