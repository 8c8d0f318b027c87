package com.acme.authz.policy;

import java.util.Locale;

/**
 * Effect of a statement whose identity, operation and resource patterns all match.
 */
public enum Effect {
    ALLOW,
    DENY;

    /**
     * Parses a document value, ignoring case and surrounding whitespace.
     *
     * @return the effect, or {@code null} when the value is missing or unrecognized
     */
    public static Effect fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "allow" -> ALLOW;
            case "deny" -> DENY;
            default -> null;
        };
    }
}
