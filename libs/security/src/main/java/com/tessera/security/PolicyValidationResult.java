package com.tessera.security;

import java.util.List;

/**
 * Result of validating a policy document: either valid, or invalid with every error found.
 *
 * @param valid  whether the document passed all checks
 * @param errors error messages, empty when valid
 */
public record PolicyValidationResult(boolean valid, List<String> errors) {

    public static PolicyValidationResult ok() {
        return new PolicyValidationResult(true, List.of());
    }

    public static PolicyValidationResult fail(List<String> errors) {
        return new PolicyValidationResult(false, List.copyOf(errors));
    }
}
