package com.librarycatalog.auth;

import java.util.List;

/**
 * Outcome of {@link PrincipalNormalizer#validate}; lists every violated rule.
 */
public record ValidationResult(List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
