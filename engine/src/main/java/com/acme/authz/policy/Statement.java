package com.acme.authz.policy;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A validated rule of a {@link Policy}.
 *
 * <p>Pattern sets keep document order with duplicates collapsed and are unmodifiable.
 *
 * @param index       zero-based position in the policy, which is also evaluation order
 * @param description free text from the document, may be {@code null}
 */
public record Statement(
    int index,
    Effect effect,
    String description,
    Set<String> identities,
    Set<String> operations,
    Set<String> resources
) {
    public Statement {
        Objects.requireNonNull(effect, "effect");
        identities = copy(identities, "identities");
        operations = copy(operations, "operations");
        resources = copy(resources, "resources");
    }

    /**
     * Creates a statement from pattern collections in document order; duplicates collapse.
     */
    public static Statement of(int index,
                               Effect effect,
                               String description,
                               Collection<String> identities,
                               Collection<String> operations,
                               Collection<String> resources) {
        return new Statement(index, effect, description,
            copy(identities, "identities"),
            copy(operations, "operations"),
            copy(resources, "resources"));
    }

    public Set<String> patterns(Field field) {
        Objects.requireNonNull(field, "field");
        return switch (field) {
            case IDENTITY -> identities;
            case OPERATION -> operations;
            case RESOURCE -> resources;
        };
    }

    public Decision decision() {
        return Decision.of(effect);
    }

    private static Set<String> copy(Collection<String> values, String name) {
        Objects.requireNonNull(values, name);
        LinkedHashSet<String> out = new LinkedHashSet<>(values.size());
        for (String value : values) {
            out.add(Objects.requireNonNull(value, name + " entry"));
        }
        return Collections.unmodifiableSet(out);
    }
}
