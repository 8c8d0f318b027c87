package com.acme.authz.config;

import com.acme.authz.audit.AuditSink;
import com.acme.authz.audit.LoggingAuditSink;
import com.acme.authz.audit.NoopAuditSink;
import com.acme.authz.matcher.ExactMatcher;
import com.acme.authz.matcher.ResourceMatcher;
import com.acme.authz.matcher.StartsWithMatcher;
import com.acme.authz.policy.Decision;
import com.acme.authz.policy.Policy;
import com.acme.authz.policy.PolicyBuildException;
import com.acme.authz.policy.PolicyBuilder;
import com.acme.authz.policy.PolicyParseException;
import com.acme.authz.util.AuthzDefaults;
import com.acme.authz.util.AuthzEnvKeys;
import com.acme.authz.util.EnvVars;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds a policy from a JSON file named by the environment.
 *
 * <p>Keys: {@code AUTHZ_POLICY_FILE} (required), {@code AUTHZ_DEFAULT_DECISION}
 * ({@code allowed}/{@code denied}), {@code AUTHZ_MATCHER} ({@code exact}/{@code prefix})
 * and {@code AUTHZ_AUDIT_LOG}. Unrecognized values fall back to the defaults.
 */
public final class EnvPolicyLoader {
    private static final Logger LOG = Logger.getLogger(EnvPolicyLoader.class.getName());

    private EnvPolicyLoader() {
    }

    public static Policy<Object> fromEnvironment() throws PolicyBuildException {
        return load(System.getenv());
    }

    public static Policy<Object> load(Map<String, String> env) throws PolicyBuildException {
        Objects.requireNonNull(env, "env");

        String file = EnvVars.getOrDefault(env, AuthzEnvKeys.AUTHZ_POLICY_FILE, "");
        if (file.isEmpty()) {
            throw new PolicyParseException(AuthzEnvKeys.AUTHZ_POLICY_FILE + " is not set");
        }
        Path path = Path.of(file);
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new PolicyParseException("cannot read policy file " + path + ": " + e.getMessage(), e);
        }

        Decision defaultDecision = parseDecision(env);
        ResourceMatcher<Object> matcher = parseMatcher(env);
        AuditSink auditSink = EnvVars.getBoolean(env, AuthzEnvKeys.AUTHZ_AUDIT_LOG, AuthzDefaults.DEFAULT_AUDIT_LOG)
            ? new LoggingAuditSink()
            : NoopAuditSink.INSTANCE;

        Policy<Object> policy = PolicyBuilder.fromJson(json)
            .withMatcher(matcher)
            .withDefaultDecision(defaultDecision)
            .withAuditSink(auditSink)
            .build();
        LOG.info("Loaded policy file=" + path + " statements=" + policy.statements().size()
            + " defaultDecision=" + defaultDecision + " matcher=" + matcher.getClass().getSimpleName());
        return policy;
    }

    private static Decision parseDecision(Map<String, String> env) {
        String raw = EnvVars.getOrDefault(env, AuthzEnvKeys.AUTHZ_DEFAULT_DECISION, "");
        if (raw.isEmpty()) {
            return AuthzDefaults.DEFAULT_DECISION;
        }
        Decision decision = Decision.fromString(raw);
        if (decision == null) {
            LOG.warning("Ignoring " + AuthzEnvKeys.AUTHZ_DEFAULT_DECISION + "=" + raw
                + ", using " + AuthzDefaults.DEFAULT_DECISION);
            return AuthzDefaults.DEFAULT_DECISION;
        }
        return decision;
    }

    private static ResourceMatcher<Object> parseMatcher(Map<String, String> env) {
        String raw = EnvVars.getOrDefault(env, AuthzEnvKeys.AUTHZ_MATCHER, AuthzDefaults.DEFAULT_MATCHER);
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "exact" -> ExactMatcher.INSTANCE;
            case "prefix", "starts_with", "starts-with" -> StartsWithMatcher.INSTANCE;
            default -> {
                LOG.warning("Ignoring " + AuthzEnvKeys.AUTHZ_MATCHER + "=" + raw + ", using exact matching");
                yield ExactMatcher.INSTANCE;
            }
        };
    }
}
