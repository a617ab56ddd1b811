package com.tessera.security;

import java.util.Collection;

/**
 * Evaluates policy documents for one request. Deny dominates: the first firing deny statement
 * ends evaluation.
 */
public final class PolicyEvaluator {

    private PolicyEvaluator() {
        // utility class
    }

    public static PolicyOutcome evaluate(Collection<PolicyDocument> documents, ResourcePattern action,
                                         ResourcePattern resource) {
        if (documents == null || action == null || resource == null) {
            return PolicyOutcome.SILENT;
        }
        boolean allowed = false;
        for (PolicyDocument document : documents) {
            for (PolicyStatement statement : document.statements()) {
                if (!statement.fires(action, resource)) {
                    continue;
                }
                if (statement.effect() == Effect.DENY) {
                    return PolicyOutcome.DENY;
                }
                allowed = true;
            }
        }
        return allowed ? PolicyOutcome.ALLOW : PolicyOutcome.SILENT;
    }
}
