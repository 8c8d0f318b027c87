package com.acme.authz.policy;

import com.acme.authz.audit.AuditSink;
import com.acme.authz.audit.NoopAuditSink;
import com.acme.authz.definition.PolicyDocumentParser;
import com.acme.authz.definition.RawStatement;
import com.acme.authz.matcher.ExactMatcher;
import com.acme.authz.matcher.ResourceMatcher;
import com.acme.authz.substitution.DefaultSubstituter;
import com.acme.authz.substitution.Substituter;
import com.acme.authz.util.AuthzDefaults;
import com.acme.authz.validation.DefaultStatementValidator;
import com.acme.authz.validation.StatementValidator;
import com.acme.authz.validation.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assembles an immutable {@link Policy} from a JSON document or an already parsed
 * statement list.
 *
 * <pre>{@code
 * Policy<Object> policy = PolicyBuilder.fromJson(json)
 *     .withMatcher(StartsWithMatcher.INSTANCE)
 *     .withDefaultDecision(Decision.DENIED)
 *     .build();
 * }</pre>
 *
 * <p>Strategies with a typed request context need the context type up front:
 * {@code PolicyBuilder.<RoleContext>fromJson(json).withSubstituter(new RoleSubstituter())}.
 *
 * <p>A policy without statements is accepted; it answers every request with the
 * default decision.
 *
 * @param <C> request context type of the policy being built
 */
public final class PolicyBuilder<C> {
    private static final Logger LOG = Logger.getLogger(PolicyBuilder.class.getName());

    private final String json;
    private final List<RawStatement> rawStatements;

    private ResourceMatcher<? super C> matcher = ExactMatcher.INSTANCE;
    private Substituter<? super C> substituter = DefaultSubstituter.instance();
    private StatementValidator validator = DefaultStatementValidator.INSTANCE;
    private Decision defaultDecision = AuthzDefaults.DEFAULT_DECISION;
    private AuditSink auditSink = NoopAuditSink.INSTANCE;

    private PolicyBuilder(String json, List<RawStatement> rawStatements) {
        this.json = json;
        this.rawStatements = rawStatements;
    }

    public static <C> PolicyBuilder<C> fromJson(String json) {
        return new PolicyBuilder<>(Objects.requireNonNull(json, "json"), null);
    }

    public static <C> PolicyBuilder<C> fromStatements(List<RawStatement> statements) {
        Objects.requireNonNull(statements, "statements");
        return new PolicyBuilder<>(null, new ArrayList<>(statements));
    }

    public PolicyBuilder<C> withMatcher(ResourceMatcher<? super C> matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        return this;
    }

    public PolicyBuilder<C> withSubstituter(Substituter<? super C> substituter) {
        this.substituter = Objects.requireNonNull(substituter, "substituter");
        return this;
    }

    public PolicyBuilder<C> withValidator(StatementValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
        return this;
    }

    public PolicyBuilder<C> withDefaultDecision(Decision decision) {
        this.defaultDecision = Objects.requireNonNull(decision, "decision");
        return this;
    }

    public PolicyBuilder<C> withAuditSink(AuditSink auditSink) {
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
        return this;
    }

    /**
     * Parses, validates every statement in order and assembles the policy.
     *
     * @throws PolicyParseException      if the JSON source is not a well-formed policy document
     * @throws PolicyValidationException for the first statement that fails validation
     */
    public Policy<C> build() throws PolicyBuildException {
        List<RawStatement> raw = json != null ? PolicyDocumentParser.parse(json).statements() : rawStatements;

        List<Statement> statements = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            statements.add(toStatement(i, raw.get(i)));
        }

        if (statements.isEmpty()) {
            LOG.warning("Policy has no statements, every request gets defaultDecision=" + defaultDecision);
        } else if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Built policy statements=" + statements.size() + " defaultDecision=" + defaultDecision);
        }
        return new Policy<>(statements, defaultDecision, matcher, substituter, auditSink);
    }

    private Statement toStatement(int index, RawStatement raw) throws PolicyValidationException {
        if (raw == null) {
            throw rejected(index, ValidationResult.invalid("statement", "must not be null"));
        }
        ValidationResult result = Objects.requireNonNull(validator.validate(raw), "validator returned null");
        if (!result.valid()) {
            throw rejected(index, result);
        }

        // a custom validator may let these through, but a statement cannot be built without them
        Effect effect = Effect.fromString(raw.effect());
        if (effect == null) {
            throw rejected(index, ValidationResult.invalid(
                DefaultStatementValidator.EFFECT, "must be allow or deny, was '" + raw.effect() + "'"));
        }
        for (Field field : Field.values()) {
            if (raw.patterns(field).contains(null)) {
                throw rejected(index, ValidationResult.invalid(field.documentKey(), "must not contain null entries"));
            }
        }

        return Statement.of(index, effect, raw.description(), raw.identities(), raw.operations(), raw.resources());
    }

    private static PolicyValidationException rejected(int index, ValidationResult result) {
        PolicyValidationException e = new PolicyValidationException(index, result.violations());
        LOG.warning("Rejecting policy: " + e.getMessage());
        return e;
    }
}
