package com.tessera.authservice.security;

import com.tessera.security.PolicyDocument;

import java.util.List;
import java.util.Set;

/**
 * Source of the roles-derived permissions and attached policy documents of a subject.
 * Implemented by the data layer that owns users, roles and policies.
 */
public interface PrincipalDirectory {

    /**
     * Looks up the grants of a subject within a tenant.
     *
     * @param tenantId tenant from the access token, or null when the token carries none
     * @return the grants; {@link Grants#none()} for unknown subjects
     */
    Grants grantsFor(String subjectId, String tenantId);

    /**
     * @param permissions flat permission names, e.g. {@code user:*}
     * @param policies    attached policy documents
     */
    record Grants(Set<String> permissions, List<PolicyDocument> policies) {

        public Grants {
            permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
            policies = policies == null ? List.of() : List.copyOf(policies);
        }

        public static Grants none() {
            return new Grants(Set.of(), List.of());
        }
    }
}
