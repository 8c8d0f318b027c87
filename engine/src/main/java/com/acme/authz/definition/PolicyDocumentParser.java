package com.acme.authz.definition;

import com.acme.authz.policy.Field;
import com.acme.authz.policy.PolicyParseException;
import com.acme.authz.util.AuthzDefaults;
import com.acme.authz.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the JSON policy document format:
 * <pre>
 * {
 *   "schemaVersion": "2020-10-30",
 *   "statements": [
 *     { "description": "...", "effect": "allow", "identities": [...], "operations": [...], "resources": [...] }
 *   ]
 * }
 * </pre>
 * Only the shape is checked here. A missing effect or pattern list is passed on
 * as null/empty for the validator to reject. Unknown properties are ignored.
 */
public final class PolicyDocumentParser {
    private static final Set<String> SUPPORTED_SCHEMA_VERSIONS = Set.of(AuthzDefaults.SCHEMA_VERSION_2020_10_30);

    private PolicyDocumentParser() {
    }

    public static PolicyDocument parse(String json) throws PolicyParseException {
        Objects.requireNonNull(json, "json");
        if (json.isBlank()) {
            throw new PolicyParseException("policy document is empty");
        }

        JsonNode root;
        try {
            root = JsonCodec.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PolicyParseException("policy document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PolicyParseException("policy document must be a JSON object");
        }

        String schemaVersion = optionalText(root, "schemaVersion", "policy");
        if (schemaVersion != null && !SUPPORTED_SCHEMA_VERSIONS.contains(schemaVersion)) {
            throw new PolicyParseException("unsupported schemaVersion: " + schemaVersion);
        }

        JsonNode statementsNode = root.get("statements");
        if (statementsNode == null || !statementsNode.isArray()) {
            throw new PolicyParseException("missing required array field: statements");
        }

        List<RawStatement> statements = new ArrayList<>(statementsNode.size());
        for (int i = 0; i < statementsNode.size(); i++) {
            statements.add(parseStatement(statementsNode.get(i), i));
        }
        return new PolicyDocument(schemaVersion, statements);
    }

    private static RawStatement parseStatement(JsonNode node, int index) throws PolicyParseException {
        String location = "statements[" + index + "]";
        if (!node.isObject()) {
            throw new PolicyParseException(location + " must be an object");
        }
        return new RawStatement(
            optionalText(node, "effect", location),
            optionalText(node, "description", location),
            stringList(node, Field.IDENTITY.documentKey(), location),
            stringList(node, Field.OPERATION.documentKey(), location),
            stringList(node, Field.RESOURCE.documentKey(), location)
        );
    }

    private static String optionalText(JsonNode parent, String field, String location) throws PolicyParseException {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new PolicyParseException(location + "." + field + " must be a string");
        }
        return node.asText();
    }

    private static List<String> stringList(JsonNode parent, String field, String location) throws PolicyParseException {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new PolicyParseException(location + "." + field + " must be an array of strings");
        }
        List<String> out = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            if (!item.isTextual()) {
                throw new PolicyParseException(location + "." + field + "[" + i + "] must be a string");
            }
            out.add(item.asText());
        }
        return out;
    }
}
