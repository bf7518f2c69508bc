package com.archlint.core.config;

/**
 * Thrown when an invariants configuration file is missing or cannot be parsed.
 */
public class InvariantConfigException extends RuntimeException {

    public InvariantConfigException(String message) {
        super(message);
    }

    public InvariantConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
