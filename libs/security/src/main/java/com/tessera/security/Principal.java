package com.tessera.security;

import java.util.List;
import java.util.Set;

/**
 * The authenticated caller as seen by authorization: a subject, its tenant, the flat
 * permission names granted through roles, and the policy documents attached to it.
 * <p>
 * Assembled per request from validated token claims and the directory; never persisted.
 *
 * @param subjectId   the token subject
 * @param tenantId    the tenant the session belongs to
 * @param permissions permission names such as {@code user:create} or {@code user:*}
 * @param policies    attached policy documents
 */
public record Principal(String subjectId, String tenantId, Set<String> permissions, List<PolicyDocument> policies) {

    public Principal {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    public static Principal withPermissions(String subjectId, String tenantId, Set<String> permissions) {
        return new Principal(subjectId, tenantId, permissions, List.of());
    }
}
