package com.hotskills.api;

import com.hotskills.domain.exception.EncodingException;
import com.hotskills.domain.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps resolver failures to {"error": "..."} responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Request failed, snapshot store unavailable for {}", e.getCacheKey());
        return error(e);
    }

    @ExceptionHandler(EncodingException.class)
    public ResponseEntity<Map<String, String>> handleEncoding(EncodingException e) {
        log.error("Request failed, could not encode {}", e.getCacheKey());
        return error(e);
    }

    private static ResponseEntity<Map<String, String>> error(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage()));
    }
}
