package com.keywordalert.exception;

/**
 * Raised when thresholds, confusable pairs or script equivalence data cannot be used.
 */
public class KeywordConfigurationException extends RuntimeException {

    public KeywordConfigurationException(String message) {
        super(message);
    }

    public KeywordConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
