package com.rfqlog.domain.exception;

import java.util.List;

/**
 * Raised when a snapshot or request cannot be turned into change records.
 * Nothing is persisted when this is thrown.
 */
public class ValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super("Validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
