package com.ecoimpact.indicators.api;

import com.ecoimpact.indicators.exception.ReferentialIntegrityException;
import com.ecoimpact.indicators.exception.RunInProgressException;
import com.ecoimpact.indicators.exception.SchemaException;
import com.ecoimpact.indicators.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SchemaException.class)
    public ResponseEntity<Map<String, Object>> handleSchema(SchemaException e) {
        log.warn("[api] schema error: {}", e.getMessage());
        Map<String, Object> body = error(e.getMessage());
        body.put("missingColumns", e.getMissingColumns());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("[api] illegal argument: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error(e.getMessage()));
    }

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleRunInProgress(RunInProgressException e) {
        log.info("[api] rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error(e.getMessage()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("[api] store unavailable ({}): {}", e.getClassification(), e.getMessage());
        Map<String, Object> body = error(e.getMessage());
        body.put("cause", e.getClassification().name());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(ReferentialIntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleReferentialIntegrity(ReferentialIntegrityException e) {
        log.error("[api] reference reload failed after cascade: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error(e.getMessage()));
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, Object>> handleIo(UncheckedIOException e) {
        log.error("[api] input/output failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("message", message);
        return body;
    }
}
