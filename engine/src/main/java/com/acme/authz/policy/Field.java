package com.acme.authz.policy;

/**
 * The three request fields a statement constrains.
 */
public enum Field {
    IDENTITY("identities"),
    OPERATION("operations"),
    RESOURCE("resources");

    private final String documentKey;

    Field(String documentKey) {
        this.documentKey = documentKey;
    }

    /** Name of the pattern list holding this field in a policy document. */
    public String documentKey() {
        return documentKey;
    }

    /** Concrete value of this field in the given request. */
    public String requestValue(Request<?> request) {
        return switch (this) {
            case IDENTITY -> request.identity();
            case OPERATION -> request.operation();
            case RESOURCE -> request.resource();
        };
    }
}
