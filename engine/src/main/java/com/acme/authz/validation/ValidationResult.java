package com.acme.authz.validation;

import java.util.List;
import java.util.Objects;

public record ValidationResult(boolean valid, List<Violation> violations) {
    private static final ValidationResult OK = new ValidationResult(true, List.of());

    public ValidationResult {
        violations = List.copyOf(violations == null ? List.of() : violations);
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult of(List<Violation> violations) {
        return violations.isEmpty() ? OK : new ValidationResult(false, violations);
    }

    public static ValidationResult invalid(String field, String message) {
        return new ValidationResult(false, List.of(new Violation(field, message)));
    }

    /**
     * @param field   document key of the offending property, e.g. {@code "effect"}
     * @param message what is wrong with it
     */
    public record Violation(String field, String message) {
        public Violation {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(message, "message");
        }
    }
}
