package com.acme.authz.util;

/**
 * Canonical environment variable names read by {@link com.acme.authz.config.EnvPolicyLoader}.
 */
public final class AuthzEnvKeys {
    public static final String AUTHZ_POLICY_FILE = "AUTHZ_POLICY_FILE";
    public static final String AUTHZ_DEFAULT_DECISION = "AUTHZ_DEFAULT_DECISION";
    public static final String AUTHZ_MATCHER = "AUTHZ_MATCHER";
    public static final String AUTHZ_AUDIT_LOG = "AUTHZ_AUDIT_LOG";

    private AuthzEnvKeys() {
    }
}
