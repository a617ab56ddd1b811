package com.tessera.security;

import com.tessera.security.testing.TestPrincipalFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PermissionChecker")
class PermissionCheckerTest {

    private final Principal principal = TestPrincipalFactory.withPermissions("user:*", "role:read");

    @Test
    @DisplayName("hasPermission honours wildcards")
    void hasPermission() {
        assertThat(PermissionChecker.hasPermission(principal, "user:create")).isTrue();
        assertThat(PermissionChecker.hasPermission(principal, "role:read")).isTrue();
        assertThat(PermissionChecker.hasPermission(principal, "role:create")).isFalse();
        assertThat(PermissionChecker.hasPermission(principal, "role")).isFalse();
        assertThat(PermissionChecker.hasPermission(null, "user:create")).isFalse();
    }

    @Test
    @DisplayName("hasAnyPermission needs one match")
    void hasAny() {
        assertThat(PermissionChecker.hasAnyPermission(principal, "role:create", "role:read")).isTrue();
        assertThat(PermissionChecker.hasAnyPermission(principal, "role:create", "tenant:read")).isFalse();
        assertThat(PermissionChecker.hasAnyPermission(principal)).isFalse();
    }

    @Test
    @DisplayName("hasAllPermissions needs every match")
    void hasAll() {
        assertThat(PermissionChecker.hasAllPermissions(principal, "user:delete", "role:read")).isTrue();
        assertThat(PermissionChecker.hasAllPermissions(principal, "user:delete", "role:create")).isFalse();
    }

    @Test
    @DisplayName("allows requires the action to belong to the resource family")
    void allowsChecksResourceFamily() {
        ResourcePattern action = ResourcePattern.parse("user:create").orElseThrow();

        assertThat(PermissionChecker.allows(principal.permissions(), action,
                ResourcePattern.parseResource("user:u-1").orElseThrow())).isTrue();
        assertThat(PermissionChecker.allows(principal.permissions(), action,
                ResourcePattern.parseResource("role").orElseThrow())).isFalse();
        assertThat(PermissionChecker.allows(principal.permissions(), action, null)).isFalse();
    }
}
