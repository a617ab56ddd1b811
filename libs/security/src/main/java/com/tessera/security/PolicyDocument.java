package com.tessera.security;

import java.util.List;

/**
 * An immutable, validated policy document. Documents are replaced whole, never edited.
 *
 * @param version    document format version, e.g. {@code v1}
 * @param statements at least one statement
 */
public record PolicyDocument(String version, List<PolicyStatement> statements) {

    public PolicyDocument {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version must not be blank");
        }
        if (statements == null || statements.isEmpty()) {
            throw new IllegalArgumentException("statements must not be empty");
        }
        statements = List.copyOf(statements);
    }

    public static PolicyDocument of(String version, PolicyStatement... statements) {
        return new PolicyDocument(version, List.of(statements));
    }
}
