package com.acme.authz.audit;

import com.acme.authz.policy.Decision;

import java.util.Objects;

/**
 * @param statementIndex position of the matching statement, or {@link #NO_STATEMENT}
 *                       when the default decision applied
 */
public record AuditEvent(
    long tsEpochMs,
    String identity,
    String operation,
    String resource,
    Decision decision,
    int statementIndex
) {
    public static final int NO_STATEMENT = -1;

    public AuditEvent {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(decision, "decision");
    }

    public boolean defaulted() {
        return statementIndex == NO_STATEMENT;
    }
}
