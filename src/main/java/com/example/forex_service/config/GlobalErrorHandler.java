package com.example.forex_service.config;

import com.example.forex_service.service.ForexPairPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class GlobalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(ForexPairPersistenceException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, String> handlePersistenceFailure(ForexPairPersistenceException ex) {
        log.error("Persisting forex pairs failed, memory and file may differ until the next write", ex);
        return Map.of("error", ex.getMessage());
    }

    // An id segment that is not an unsigned 64-bit number matches no route.
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Void> handleBadPathId(MethodArgumentTypeMismatchException ex) {
        log.debug("Rejecting path value {} for {}", ex.getValue(), ex.getName());
        return ResponseEntity.notFound().build();
    }
}
