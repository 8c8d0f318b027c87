package com.acme.authz.util;

import com.acme.authz.policy.Decision;

/**
 * Defaults applied when a builder option or environment variable is not set.
 */
public final class AuthzDefaults {

    // ---- Evaluation ----
    public static final Decision DEFAULT_DECISION = Decision.DENIED;

    // ---- Environment values ----
    public static final String DEFAULT_MATCHER = "exact";
    public static final boolean DEFAULT_AUDIT_LOG = false;

    // ---- Policy document ----
    public static final String SCHEMA_VERSION_2020_10_30 = "2020-10-30";

    private AuthzDefaults() {
    }
}
