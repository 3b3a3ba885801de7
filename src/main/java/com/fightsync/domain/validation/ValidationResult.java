package com.fightsync.domain.validation;

import java.util.List;

/**
 * Outcome of validating one scraped record. Errors are in field order.
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }
}
