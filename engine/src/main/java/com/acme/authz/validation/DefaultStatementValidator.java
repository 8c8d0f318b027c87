package com.acme.authz.validation;

import com.acme.authz.definition.RawStatement;
import com.acme.authz.policy.Effect;
import com.acme.authz.policy.Field;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal sanity checks:
 * - effect present and one of allow/deny (case-insensitive)
 * - identities, operations and resources non-empty
 * - no blank pattern entries
 */
public final class DefaultStatementValidator implements StatementValidator {
    public static final String EFFECT = "effect";
    public static final DefaultStatementValidator INSTANCE = new DefaultStatementValidator();

    private DefaultStatementValidator() {
    }

    @Override
    public ValidationResult validate(RawStatement statement) {
        List<ValidationResult.Violation> violations = new ArrayList<>();

        String effect = statement.effect();
        if (effect == null || effect.isBlank()) {
            violations.add(new ValidationResult.Violation(EFFECT, "is required"));
        } else if (Effect.fromString(effect) == null) {
            violations.add(new ValidationResult.Violation(EFFECT, "must be allow or deny, was '" + effect + "'"));
        }

        for (Field field : Field.values()) {
            validatePatterns(field.documentKey(), statement.patterns(field), violations);
        }

        return ValidationResult.of(violations);
    }

    private static void validatePatterns(String key, List<String> patterns, List<ValidationResult.Violation> violations) {
        if (patterns.isEmpty()) {
            violations.add(new ValidationResult.Violation(key, "must not be empty"));
            return;
        }
        for (int i = 0; i < patterns.size(); i++) {
            String pattern = patterns.get(i);
            if (pattern == null || pattern.isBlank()) {
                violations.add(new ValidationResult.Violation(key, "entry " + i + " is blank"));
            }
        }
    }
}
