package com.librarycatalog.exception;

import java.util.List;

/**
 * Malformed or incomplete data; carries every violated rule.
 */
public class ValidationException extends RuntimeException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super("Validation failed: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
