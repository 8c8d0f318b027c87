package com.acme.authz.definition;

import java.util.List;

/**
 * Parsed policy document.
 *
 * @param schemaVersion declared version, or {@code null} when the document omits it
 * @param statements    statements in document order
 */
public record PolicyDocument(String schemaVersion, List<RawStatement> statements) {
    public PolicyDocument {
        statements = List.copyOf(statements == null ? List.of() : statements);
    }
}
