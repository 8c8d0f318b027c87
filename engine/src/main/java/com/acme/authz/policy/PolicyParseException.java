package com.acme.authz.policy;

/**
 * The policy source is not a well-formed policy document.
 */
public final class PolicyParseException extends PolicyBuildException {

    public PolicyParseException(String message) {
        super(message);
    }

    public PolicyParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
