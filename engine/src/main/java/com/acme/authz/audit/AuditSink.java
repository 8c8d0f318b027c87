package com.acme.authz.audit;

/**
 * Receives one event per decision produced by a {@link com.acme.authz.policy.Policy}.
 *
 * <p>Called synchronously on the evaluating thread. Implementations must be
 * thread-safe, must not block and must not throw.
 */
@FunctionalInterface
public interface AuditSink {
    void append(AuditEvent event);
}
