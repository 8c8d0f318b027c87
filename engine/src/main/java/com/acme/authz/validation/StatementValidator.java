package com.acme.authz.validation;

import com.acme.authz.definition.RawStatement;

/**
 * Structural check applied to every statement before it becomes part of a policy.
 *
 * <p>Runs once per statement at build time, in document order. The first invalid
 * statement aborts the build.
 */
@FunctionalInterface
public interface StatementValidator {
    ValidationResult validate(RawStatement statement);

    /** Runs {@code this}, then {@code next} if this one passed. */
    default StatementValidator andThen(StatementValidator next) {
        return statement -> {
            ValidationResult result = validate(statement);
            return result.valid() ? next.validate(statement) : result;
        };
    }
}
