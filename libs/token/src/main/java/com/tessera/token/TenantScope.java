package com.tessera.token;

/**
 * Tenant context carried on access tokens.
 * <p>
 * Each component is optional; absent values are simply not emitted as claims.
 *
 * @param tenantId   the tenant (auth container) the session belongs to
 * @param clientId   the client the token was issued through
 * @param providerId the identity provider that authenticated the subject
 */
public record TenantScope(String tenantId, String clientId, String providerId) {

    public static TenantScope ofTenant(String tenantId) {
        return new TenantScope(tenantId, null, null);
    }

    /** True when no component is set. */
    public boolean isEmpty() {
        return isBlank(tenantId) && isBlank(clientId) && isBlank(providerId);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
