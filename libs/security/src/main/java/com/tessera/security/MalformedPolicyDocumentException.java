package com.tessera.security;

import java.util.List;

/**
 * A policy document could not be parsed or failed validation.
 */
public class MalformedPolicyDocumentException extends RuntimeException {

    private final List<String> errors;

    public MalformedPolicyDocumentException(List<String> errors) {
        super("Malformed policy document: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public MalformedPolicyDocumentException(String error, Throwable cause) {
        super("Malformed policy document: " + error, cause);
        this.errors = List.of(error);
    }

    /** Every problem found, one message each. */
    public List<String> errors() {
        return errors;
    }
}
