package com.acme.authz.policy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class EffectTest {

    @Test
    void shouldParseEffectIgnoringCaseAndWhitespace() {
        for (String raw : List.of("allow", "Allow", "ALLOW", "  allow\t")) {
            assertEquals(Effect.ALLOW, Effect.fromString(raw), raw);
        }
        for (String raw : List.of("deny", "Deny", "DENY", " deny ")) {
            assertEquals(Effect.DENY, Effect.fromString(raw), raw);
        }
    }

    @Test
    void shouldReturnNullForUnknownEffect() {
        for (String raw : new String[]{null, "", " ", "permit", "allowed", "al low"}) {
            assertNull(Effect.fromString(raw), raw);
        }
    }

    @Test
    void shouldMapEffectToDecision() {
        assertEquals(Decision.ALLOWED, Decision.of(Effect.ALLOW));
        assertEquals(Decision.DENIED, Decision.of(Effect.DENY));
    }

    @Test
    void shouldParseDecisionNames() {
        assertEquals(Decision.ALLOWED, Decision.fromString("Allowed"));
        assertEquals(Decision.ALLOWED, Decision.fromString("allow"));
        assertEquals(Decision.DENIED, Decision.fromString(" DENIED "));
        assertNull(Decision.fromString("maybe"));
        assertNull(Decision.fromString(null));
    }
}
