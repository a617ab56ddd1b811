package com.tessera.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a wire-shaped policy document and collects every error at once, so a caller can fix
 * all statements in one round.
 */
final class PolicyDocumentValidator {

    private PolicyDocumentValidator() {
        // utility class
    }

    static PolicyValidationResult validate(PolicyDocumentWire document) {
        var errors = new ArrayList<String>();
        if (document == null) {
            errors.add("document must be a JSON object");
            return PolicyValidationResult.fail(errors);
        }
        if (isBlank(document.version())) {
            errors.add("version must not be blank");
        }
        List<PolicyDocumentWire.Statement> statements = document.statement();
        if (statements == null || statements.isEmpty()) {
            errors.add("statement must contain at least one entry");
        } else {
            for (int i = 0; i < statements.size(); i++) {
                validateStatement(statements.get(i), "statement[" + i + "]", errors);
            }
        }
        return errors.isEmpty() ? PolicyValidationResult.ok() : PolicyValidationResult.fail(errors);
    }

    private static void validateStatement(PolicyDocumentWire.Statement statement, String path, List<String> errors) {
        if (statement == null) {
            errors.add(path + " must not be null");
            return;
        }
        if (isBlank(statement.effect())) {
            errors.add(path + ".effect must not be blank");
        } else if (Effect.fromValue(statement.effect()).isEmpty()) {
            errors.add(path + ".effect must be 'allow' or 'deny'");
        }
        validateEntries(statement.action(), path + ".action", errors);
        validateEntries(statement.resource(), path + ".resource", errors);
    }

    private static void validateEntries(List<String> entries, String path, List<String> errors) {
        if (entries == null || entries.isEmpty()) {
            errors.add(path + " must contain at least one entry");
            return;
        }
        for (int i = 0; i < entries.size(); i++) {
            if (isBlank(entries.get(i))) {
                errors.add(path + "[" + i + "] must not be blank");
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
