package com.tessera.security;

import java.util.Collection;

/**
 * Flat permission checks against the permission names granted to a {@link Principal}.
 * <p>
 * A granted name is a pattern: {@code user:*} covers {@code user:create}. Granted names that
 * are not of the form {@code family:name} never match.
 */
public final class PermissionChecker {

    private PermissionChecker() {
        // utility class
    }

    /** True when any granted permission matches the qualified action. */
    public static boolean allows(Collection<String> granted, ResourcePattern action) {
        if (granted == null || action == null) {
            return false;
        }
        return granted.stream().anyMatch(pattern -> ResourcePattern.matches(pattern, action));
    }

    /**
     * True when a granted permission matches the qualified action and the action belongs to
     * the family of the requested resource.
     */
    public static boolean allows(Collection<String> granted, ResourcePattern action, ResourcePattern resource) {
        if (action == null || resource == null || !action.family().equals(resource.family())) {
            return false;
        }
        return allows(granted, action);
    }

    /**
     * Checks a single required permission name such as {@code role:create}.
     */
    public static boolean hasPermission(Principal principal, String required) {
        if (principal == null) {
            return false;
        }
        return ResourcePattern.parse(required)
                .map(action -> allows(principal.permissions(), action))
                .orElse(false);
    }

    /**
     * Checks if the principal has ANY of the required permissions. An empty list is not satisfied.
     */
    public static boolean hasAnyPermission(Principal principal, String... required) {
        for (String permission : required) {
            if (hasPermission(principal, permission)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if the principal has ALL of the required permissions.
     */
    public static boolean hasAllPermissions(Principal principal, String... required) {
        if (required.length == 0) {
            return principal != null;
        }
        for (String permission : required) {
            if (!hasPermission(principal, permission)) {
                return false;
            }
        }
        return true;
    }
}
