package com.acme.authz.policy;

import com.acme.authz.audit.AuditEvent;
import com.acme.authz.audit.AuditSink;
import com.acme.authz.matcher.ResourceMatcher;
import com.acme.authz.substitution.Substituter;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only, ordered set of statements that decides {@link Request}s.
 *
 * <p>Statements are consulted in document order and the first one whose identity,
 * operation and resource patterns all match decides the request. When none
 * matches, the default decision applies. Every pattern is passed through the
 * substituter and then the matcher, for all three fields.
 *
 * <p>A policy is immutable once built and may be evaluated from any number of
 * threads without locking. Build a new policy to change rules.
 *
 * @param <C> request context type understood by the configured strategies
 */
public final class Policy<C> {
    private static final Logger LOG = Logger.getLogger(Policy.class.getName());

    private final List<Statement> statements;
    private final Decision defaultDecision;
    private final ResourceMatcher<? super C> matcher;
    private final Substituter<? super C> substituter;
    private final AuditSink auditSink;

    Policy(List<Statement> statements,
           Decision defaultDecision,
           ResourceMatcher<? super C> matcher,
           Substituter<? super C> substituter,
           AuditSink auditSink) {
        this.statements = List.copyOf(statements);
        this.defaultDecision = Objects.requireNonNull(defaultDecision, "defaultDecision");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.substituter = Objects.requireNonNull(substituter, "substituter");
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
    }

    /**
     * Decides the request.
     *
     * @throws EvaluationException if the matcher or substituter fails; no decision is made
     */
    public Decision evaluate(Request<? extends C> request) throws EvaluationException {
        return explain(request).decision();
    }

    /**
     * Decides the request and reports which statement, if any, produced the decision.
     *
     * @throws EvaluationException if the matcher or substituter fails; no decision is made
     */
    public EvaluationOutcome explain(Request<? extends C> request) throws EvaluationException {
        Objects.requireNonNull(request, "request");

        EvaluationOutcome outcome = new EvaluationOutcome.Defaulted(defaultDecision);
        for (Statement statement : statements) {
            if (matches(statement, request)) {
                outcome = new EvaluationOutcome.Matched(statement.decision(), statement);
                break;
            }
        }

        int statementIndex = outcome instanceof EvaluationOutcome.Matched matched
            ? matched.statementIndex()
            : AuditEvent.NO_STATEMENT;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("decision=" + outcome.decision() + " statement=" + statementIndex + " " + request);
        }
        auditSink.append(new AuditEvent(
            System.currentTimeMillis(),
            request.identity(),
            request.operation(),
            request.resource(),
            outcome.decision(),
            statementIndex
        ));
        return outcome;
    }

    public List<Statement> statements() {
        return statements;
    }

    public Decision defaultDecision() {
        return defaultDecision;
    }

    private boolean matches(Statement statement, Request<? extends C> request) throws EvaluationException {
        return matchesAny(Field.IDENTITY, statement.identities(), request)
            && matchesAny(Field.OPERATION, statement.operations(), request)
            && matchesAny(Field.RESOURCE, statement.resources(), request);
    }

    private boolean matchesAny(Field field, Set<String> patterns, Request<? extends C> request)
        throws EvaluationException {
        String input = field.requestValue(request);
        for (String pattern : patterns) {
            String resolved = substituter.substitute(field, pattern, request);
            Objects.requireNonNull(resolved, "substituter returned null");
            if (matcher.matches(request, input, resolved)) {
                return true;
            }
        }
        return false;
    }
}
