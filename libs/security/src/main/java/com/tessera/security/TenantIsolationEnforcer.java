package com.tessera.security;

/**
 * Verifies that a principal only touches resources of its own tenant.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @param principal        the authenticated caller
     * @param resourceTenantId the tenant owning the resource
     * @throws TenantMismatchException if the tenants differ or the principal has no tenant
     */
    public static void enforce(Principal principal, String resourceTenantId) {
        String principalTenantId = principal.tenantId();
        if (principalTenantId == null || !principalTenantId.equals(resourceTenantId)) {
            throw new TenantMismatchException(principalTenantId, resourceTenantId);
        }
    }
}
