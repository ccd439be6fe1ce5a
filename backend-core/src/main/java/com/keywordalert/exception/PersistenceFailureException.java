package com.keywordalert.exception;

/**
 * A durable write or read failed. In-memory state has been left matching the store.
 */
public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
