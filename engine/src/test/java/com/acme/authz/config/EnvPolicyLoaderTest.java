package com.acme.authz.config;

import com.acme.authz.policy.Decision;
import com.acme.authz.policy.Policy;
import com.acme.authz.policy.PolicyParseException;
import com.acme.authz.policy.PolicyValidationException;
import com.acme.authz.policy.Request;
import com.acme.authz.util.AuthzEnvKeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvPolicyLoaderTest {
    private static final String HOME_POLICY = """
        {
          "schemaVersion": "2020-10-30",
          "statements": [
            {"effect": "allow", "identities": ["{{any}}"], "operations": ["read", "write"],
             "resources": ["/home/{{identity}}/"]}
          ]
        }
        """;

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadPolicyWithDefaults() throws Exception {
        Path file = write("policy.json", HOME_POLICY);

        Policy<Object> policy = EnvPolicyLoader.load(Map.of(AuthzEnvKeys.AUTHZ_POLICY_FILE, file.toString()));

        assertEquals(Decision.DENIED, policy.defaultDecision());
        assertEquals(1, policy.statements().size());
        // exact matching by default
        assertEquals(Decision.DENIED, policy.evaluate(Request.of("johndoe", "write", "/home/johndoe/my.resource")));
        assertEquals(Decision.ALLOWED, policy.evaluate(Request.of("johndoe", "write", "/home/johndoe/")));
    }

    @Test
    void shouldApplyMatcherDecisionAndAuditSettings() throws Exception {
        Path file = write("policy.json", HOME_POLICY);

        Policy<Object> policy = EnvPolicyLoader.load(Map.of(
            AuthzEnvKeys.AUTHZ_POLICY_FILE, "  " + file + "  ",
            AuthzEnvKeys.AUTHZ_MATCHER, "Prefix",
            AuthzEnvKeys.AUTHZ_DEFAULT_DECISION, "ALLOWED",
            AuthzEnvKeys.AUTHZ_AUDIT_LOG, "true"
        ));

        assertEquals(Decision.ALLOWED, policy.defaultDecision());
        assertEquals(Decision.ALLOWED, policy.evaluate(Request.of("johndoe", "write", "/home/johndoe/my.resource")));
        assertEquals(Decision.ALLOWED, policy.evaluate(Request.of("johndoe", "delete", "/home/other/")));
    }

    @Test
    void shouldFallBackOnUnrecognizedValues() throws Exception {
        Path file = write("policy.json", HOME_POLICY);

        Policy<Object> policy = EnvPolicyLoader.load(Map.of(
            AuthzEnvKeys.AUTHZ_POLICY_FILE, file.toString(),
            AuthzEnvKeys.AUTHZ_MATCHER, "regex",
            AuthzEnvKeys.AUTHZ_DEFAULT_DECISION, "maybe"
        ));

        assertEquals(Decision.DENIED, policy.defaultDecision());
        assertEquals(Decision.DENIED, policy.evaluate(Request.of("johndoe", "write", "/home/johndoe/my.resource")));
    }

    @Test
    void shouldFailWhenFileIsMissingOrUnset() {
        assertThrows(PolicyParseException.class, () -> EnvPolicyLoader.load(Map.of()));
        assertThrows(PolicyParseException.class, () -> EnvPolicyLoader.load(Map.of(AuthzEnvKeys.AUTHZ_POLICY_FILE, "   ")));

        PolicyParseException e = assertThrows(PolicyParseException.class, () -> EnvPolicyLoader.load(
            Map.of(AuthzEnvKeys.AUTHZ_POLICY_FILE, tempDir.resolve("absent.json").toString())));
        assertTrue(e.getMessage().contains("absent.json"), e.getMessage());
    }

    @Test
    void shouldSurfaceBuildErrorsFromFile() throws Exception {
        Path malformed = write("malformed.json", "{\"statements\": [");
        Path invalid = write("invalid.json", "{\"statements\": [{\"effect\": \"allow\", \"identities\": [\"a\"]}]}");

        assertThrows(PolicyParseException.class,
            () -> EnvPolicyLoader.load(Map.of(AuthzEnvKeys.AUTHZ_POLICY_FILE, malformed.toString())));
        PolicyValidationException e = assertThrows(PolicyValidationException.class,
            () -> EnvPolicyLoader.load(Map.of(AuthzEnvKeys.AUTHZ_POLICY_FILE, invalid.toString())));
        assertEquals(0, e.statementIndex());
        assertEquals("operations", e.field());
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
