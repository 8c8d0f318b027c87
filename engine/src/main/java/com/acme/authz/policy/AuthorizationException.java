package com.acme.authz.policy;

/**
 * Root of every checked failure raised by the engine: building a policy,
 * constructing a request or evaluating one.
 */
public abstract class AuthorizationException extends Exception {

    protected AuthorizationException(String message) {
        super(message);
    }

    protected AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
