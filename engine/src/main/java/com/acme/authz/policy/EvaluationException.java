package com.acme.authz.policy;

/**
 * A matcher or substituter failed while evaluating a request. No decision is
 * produced for that request; the policy remains usable.
 */
public abstract class EvaluationException extends AuthorizationException {

    protected EvaluationException(String message) {
        super(message);
    }

    protected EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
