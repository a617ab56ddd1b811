package com.tessera.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Parses policy documents from JSON.
 * <p>
 * Shape: {@code {"version": "v1", "statement": [{"effect": "allow", "action": [...],
 * "resource": [...]}]}}. Unknown properties are ignored; a value of the wrong JSON type makes
 * the document malformed.
 */
public final class PolicyDocumentParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PolicyDocumentParser() {
        // utility class
    }

    /**
     * Parses and validates a document.
     *
     * @throws MalformedPolicyDocumentException with every validation error found
     */
    public static PolicyDocument parse(String json) {
        PolicyDocumentWire wire = read(json);
        PolicyValidationResult result = PolicyDocumentValidator.validate(wire);
        if (!result.valid()) {
            throw new MalformedPolicyDocumentException(result.errors());
        }
        List<PolicyStatement> statements = wire.statement().stream()
                .map(s -> new PolicyStatement(Effect.fromValue(s.effect()).orElseThrow(), s.action(), s.resource()))
                .toList();
        return new PolicyDocument(wire.version(), statements);
    }

    /** Validates a document without building it. Never throws for bad input. */
    public static PolicyValidationResult validate(String json) {
        try {
            return PolicyDocumentValidator.validate(read(json));
        } catch (MalformedPolicyDocumentException e) {
            return PolicyValidationResult.fail(e.errors());
        }
    }

    /** Serializes a document back to its JSON shape. */
    public static String toJson(PolicyDocument document) {
        List<PolicyDocumentWire.Statement> statements = document.statements().stream()
                .map(s -> new PolicyDocumentWire.Statement(s.effect().value(), s.actions(), s.resources()))
                .toList();
        try {
            return MAPPER.writeValueAsString(new PolicyDocumentWire(document.version(), statements));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize policy document", e);
        }
    }

    private static PolicyDocumentWire read(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedPolicyDocumentException(List.of("document must not be empty"));
        }
        try {
            return MAPPER.readValue(json, PolicyDocumentWire.class);
        } catch (JsonProcessingException e) {
            throw new MalformedPolicyDocumentException("document is not valid JSON of the expected shape", e);
        }
    }
}
