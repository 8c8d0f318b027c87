package com.acme.authz.policy;

import java.util.Locale;
import java.util.Objects;

public enum Decision {
    ALLOWED,
    DENIED;

    public static Decision of(Effect effect) {
        Objects.requireNonNull(effect, "effect");
        return switch (effect) {
            case ALLOW -> ALLOWED;
            case DENY -> DENIED;
        };
    }

    /**
     * Parses a configuration value ({@code allowed}/{@code allow}, {@code denied}/{@code deny}).
     *
     * @return the decision, or {@code null} when the value is missing or unrecognized
     */
    public static Decision fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "allowed", "allow" -> ALLOWED;
            case "denied", "deny" -> DENIED;
            default -> null;
        };
    }
}
