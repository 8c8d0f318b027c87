package com.acme.authz.definition;

import com.acme.authz.policy.Field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A statement as read from a policy document, before validation.
 *
 * <p>The effect is kept as written and pattern lists may be empty or hold blank
 * entries; rejecting those is the validator's job.
 */
public record RawStatement(
    String effect,
    String description,
    List<String> identities,
    List<String> operations,
    List<String> resources
) {
    public RawStatement {
        identities = copy(identities);
        operations = copy(operations);
        resources = copy(resources);
    }

    public static RawStatement allow(List<String> identities, List<String> operations, List<String> resources) {
        return new RawStatement("allow", null, identities, operations, resources);
    }

    public static RawStatement deny(List<String> identities, List<String> operations, List<String> resources) {
        return new RawStatement("deny", null, identities, operations, resources);
    }

    public List<String> patterns(Field field) {
        Objects.requireNonNull(field, "field");
        return switch (field) {
            case IDENTITY -> identities;
            case OPERATION -> operations;
            case RESOURCE -> resources;
        };
    }

    // null entries survive so the validator can report them
    private static List<String> copy(List<String> values) {
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
