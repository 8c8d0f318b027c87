package com.acme.authz.policy;

import com.acme.authz.validation.ValidationResult;

import java.util.List;

/**
 * A statement was rejected by the configured {@link com.acme.authz.validation.StatementValidator}.
 * Carries the zero-based position of the statement and the first offending field.
 */
public final class PolicyValidationException extends PolicyBuildException {
    private final int statementIndex;
    private final String field;
    private final List<ValidationResult.Violation> violations;

    public PolicyValidationException(int statementIndex, List<ValidationResult.Violation> violations) {
        super(message(statementIndex, violations));
        this.statementIndex = statementIndex;
        this.violations = List.copyOf(violations);
        this.field = this.violations.isEmpty() ? null : this.violations.get(0).field();
    }

    public int statementIndex() {
        return statementIndex;
    }

    /** Document key of the first violation, e.g. {@code "effect"} or {@code "resources"}. */
    public String field() {
        return field;
    }

    public List<ValidationResult.Violation> violations() {
        return violations;
    }

    private static String message(int statementIndex, List<ValidationResult.Violation> violations) {
        StringBuilder sb = new StringBuilder("Invalid statement at index ").append(statementIndex);
        if (violations.isEmpty()) {
            return sb.toString();
        }
        sb.append(": ");
        for (int i = 0; i < violations.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            ValidationResult.Violation v = violations.get(i);
            sb.append(v.field()).append(' ').append(v.message());
        }
        return sb.toString();
    }
}
