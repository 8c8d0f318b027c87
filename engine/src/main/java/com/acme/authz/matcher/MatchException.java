package com.acme.authz.matcher;

import com.acme.authz.policy.EvaluationException;

public final class MatchException extends EvaluationException {
    private final String pattern;

    public MatchException(String pattern, String message) {
        super("Cannot match pattern '" + pattern + "': " + message);
        this.pattern = pattern;
    }

    public MatchException(String pattern, String message, Throwable cause) {
        super("Cannot match pattern '" + pattern + "': " + message, cause);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
