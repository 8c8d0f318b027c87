package com.acme.authz.policy;

import java.util.Locale;

/**
 * A {@link Request} was constructed with an empty identity, operation or resource.
 */
public final class InvalidRequestException extends AuthorizationException {
    private final Field field;

    public InvalidRequestException(Field field) {
        super(field.name().toLowerCase(Locale.ROOT) + " must be specified");
        this.field = field;
    }

    public Field field() {
        return field;
    }
}
