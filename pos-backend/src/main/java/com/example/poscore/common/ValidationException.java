package com.example.poscore.common;

import java.util.List;

/**
 * Malformed input detected before anything is persisted: bad quantities,
 * invalid promotion definitions, non-positive totals and the like.
 */
public class ValidationException extends PosException {

    private final List<String> errors;

    public ValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
