package com.acme.authz.policy;

/**
 * Thrown by {@link PolicyBuilder#build()}. No policy is produced when this is raised.
 */
public abstract class PolicyBuildException extends AuthorizationException {

    protected PolicyBuildException(String message) {
        super(message);
    }

    protected PolicyBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
