package com.example.poscore.common;

/**
 * Root of the domain exceptions raised by the point-of-sale core. Each subclass
 * maps to one HTTP status in {@link GlobalExceptionHandler}.
 */
public abstract class PosException extends RuntimeException {

    protected PosException(String message) {
        super(message);
    }

    protected PosException(String message, Throwable cause) {
        super(message, cause);
    }
}
