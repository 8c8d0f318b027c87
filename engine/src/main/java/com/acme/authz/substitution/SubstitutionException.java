package com.acme.authz.substitution;

import com.acme.authz.policy.EvaluationException;
import com.acme.authz.policy.Field;

public final class SubstitutionException extends EvaluationException {
    private final Field field;
    private final String pattern;

    public SubstitutionException(Field field, String pattern, String message) {
        super("Cannot substitute " + field.documentKey() + " pattern '" + pattern + "': " + message);
        this.field = field;
        this.pattern = pattern;
    }

    public SubstitutionException(Field field, String pattern, String message, Throwable cause) {
        super("Cannot substitute " + field.documentKey() + " pattern '" + pattern + "': " + message, cause);
        this.field = field;
        this.pattern = pattern;
    }

    public Field field() {
        return field;
    }

    public String pattern() {
        return pattern;
    }
}
