package com.example.forex_service.service;

/**
 * Thrown when the database file could not be written after an in-memory change.
 * The in-memory change is kept.
 */
public class ForexPairPersistenceException extends RuntimeException {

    public ForexPairPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
