package com.acme.authz.policy;

import java.util.Objects;
import java.util.Optional;

/**
 * Evaluation input: who ({@code identity}) wants to do what ({@code operation}) on
 * which {@code resource}, plus an optional caller-defined context read by custom
 * matchers and substituters.
 *
 * <p>Requests are immutable and never retained by a {@link Policy}.
 *
 * @param <C> type of the caller-defined context
 */
public final class Request<C> {
    private final String identity;
    private final String operation;
    private final String resource;
    private final C context;

    private Request(String identity, String operation, String resource, C context) {
        this.identity = identity;
        this.operation = operation;
        this.resource = resource;
        this.context = context;
    }

    public static <C> Request<C> of(String identity, String operation, String resource)
        throws InvalidRequestException {
        return of(identity, operation, resource, null);
    }

    public static <C> Request<C> of(String identity, String operation, String resource, C context)
        throws InvalidRequestException {
        requireValue(identity, Field.IDENTITY);
        requireValue(operation, Field.OPERATION);
        requireValue(resource, Field.RESOURCE);
        return new Request<>(identity, operation, resource, context);
    }

    /** Returns a copy of this request carrying {@code context}. */
    public <N> Request<N> withContext(N context) {
        Objects.requireNonNull(context, "context");
        return new Request<>(identity, operation, resource, context);
    }

    public String identity() {
        return identity;
    }

    public String operation() {
        return operation;
    }

    public String resource() {
        return resource;
    }

    public Optional<C> context() {
        return Optional.ofNullable(context);
    }

    @Override
    public String toString() {
        return "Request[identity=" + identity + ", operation=" + operation + ", resource=" + resource + "]";
    }

    private static void requireValue(String value, Field field) throws InvalidRequestException {
        if (value == null || value.isEmpty()) {
            throw new InvalidRequestException(field);
        }
    }
}
