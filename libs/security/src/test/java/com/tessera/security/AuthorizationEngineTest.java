package com.tessera.security;

import com.tessera.security.testing.TestPrincipalFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthorizationEngine")
class AuthorizationEngineTest {

    private final AuthorizationEngine engine = new AuthorizationEngine();

    @Nested
    @DisplayName("flat permissions")
    class FlatPermissions {

        private final Principal u1 = Principal.withPermissions("u1", "tenant-1", Set.of("profile:read"));

        @Test
        @DisplayName("a bare verb is qualified by the resource family")
        void bareVerbQualified() {
            assertThat(engine.authorize(u1, "read", "profile")).isEqualTo(Decision.ALLOW);
            assertThat(engine.evaluate(u1, "read", "profile").basis())
                    .isEqualTo(AuthorizationResult.Basis.PERMISSION);
        }

        @Test
        @DisplayName("without a matching permission or policy the request is denied")
        void noMatch() {
            AuthorizationResult result = engine.evaluate(u1, "write", "profile");

            assertThat(result.decision()).isEqualTo(Decision.DENY);
            assertThat(result.basis()).isEqualTo(AuthorizationResult.Basis.NO_MATCH);
        }

        @Test
        @DisplayName("a wildcard permission covers every action of the family")
        void wildcardPermission() {
            Principal admin = TestPrincipalFactory.withPermissions("user:*");

            assertThat(engine.authorize(admin, "user:delete", "user:u-42")).isEqualTo(Decision.ALLOW);
            assertThat(engine.authorize(admin, "role:delete", "role:r-1")).isEqualTo(Decision.DENY);
        }

        @ParameterizedTest(name = "{1} on {2} is denied with permission {0}")
        @CsvSource({
                "doc:read, doc:read, user",
                "api:*, api:create, user:42",
                "user:*, user:delete, auth:root"
        })
        @DisplayName("a qualified action on another family is not covered by the permission")
        void qualifiedActionOnOtherFamily(String permission, String action, String resource) {
            Principal principal = TestPrincipalFactory.withPermissions(permission);

            AuthorizationResult result = engine.evaluate(principal, action, resource);

            assertThat(result.decision()).isEqualTo(Decision.DENY);
            assertThat(result.basis()).isEqualTo(AuthorizationResult.Basis.NO_MATCH);
        }

        @Test
        @DisplayName("a qualified action on its own family is covered")
        void qualifiedActionOnOwnFamily() {
            Principal principal = TestPrincipalFactory.withPermissions("api:*");

            assertThat(engine.authorize(principal, "api:create", "api:42")).isEqualTo(Decision.ALLOW);
            assertThat(engine.authorize(principal, "api:create", "api")).isEqualTo(Decision.ALLOW);
        }

        @Test
        @DisplayName("a policy may still grant an action across families")
        void policyAcrossFamilies() {
            Principal principal = TestPrincipalFactory.withPolicies(PolicyDocument.of("v1",
                    PolicyStatement.allow(List.of("user:*"), List.of("auth:*"))));

            assertThat(engine.evaluate(principal, "user:create", "auth:tenant-1").basis())
                    .isEqualTo(AuthorizationResult.Basis.POLICY_ALLOW);
        }

        @Test
        @DisplayName("a permission without separator never matches")
        void permissionWithoutSeparator() {
            Principal odd = TestPrincipalFactory.withPermissions("profile", "read");

            assertThat(engine.authorize(odd, "read", "profile")).isEqualTo(Decision.DENY);
        }
    }

    @Nested
    @DisplayName("policy documents")
    class Policies {

        @Test
        @DisplayName("an allow statement grants access without a permission")
        void policyAllow() {
            Principal principal = TestPrincipalFactory.withPolicies(PolicyDocument.of("v1",
                    PolicyStatement.allow(List.of("account:*"), List.of("account:profile"))));

            AuthorizationResult result = engine.evaluate(principal, "update", "account:profile");

            assertThat(result.allowed()).isTrue();
            assertThat(result.basis()).isEqualTo(AuthorizationResult.Basis.POLICY_ALLOW);
        }

        @Test
        @DisplayName("a deny statement overrides a matching permission")
        void denyOverridesPermission() {
            Principal principal = TestPrincipalFactory.create(Set.of("user:*"), List.of(PolicyDocument.of("v1",
                    PolicyStatement.deny(List.of("user:delete"), List.of("user:*")))));

            AuthorizationResult result = engine.evaluate(principal, "delete", "user:u-42");

            assertThat(result.decision()).isEqualTo(Decision.DENY);
            assertThat(result.basis()).isEqualTo(AuthorizationResult.Basis.EXPLICIT_DENY);
            assertThat(engine.authorize(principal, "create", "user:u-42")).isEqualTo(Decision.ALLOW);
        }

        @Test
        @DisplayName("a deny in one document overrides an allow in another")
        void denyAcrossDocuments() {
            Principal principal = TestPrincipalFactory.withPolicies(
                    PolicyDocument.of("v1", PolicyStatement.allow(List.of("auth:*"), List.of("auth:*"))),
                    PolicyDocument.of("v1", PolicyStatement.deny(List.of("auth:login"), List.of("auth:*"))));

            assertThat(engine.authorize(principal, "login", "auth:login")).isEqualTo(Decision.DENY);
            assertThat(engine.authorize(principal, "logout", "auth:logout")).isEqualTo(Decision.ALLOW);
        }

        @Test
        @DisplayName("a bare family resource only matches wildcard resource patterns")
        void bareFamilyResource() {
            Principal specific = TestPrincipalFactory.withPolicies(PolicyDocument.of("v1",
                    PolicyStatement.allow(List.of("auth:*"), List.of("auth:login"))));
            Principal wildcard = TestPrincipalFactory.withPolicies(PolicyDocument.of("v1",
                    PolicyStatement.allow(List.of("auth:*"), List.of("auth:*"))));

            assertThat(engine.authorize(specific, "login", "auth")).isEqualTo(Decision.DENY);
            assertThat(engine.authorize(wildcard, "login", "auth")).isEqualTo(Decision.ALLOW);
        }
    }

    @Nested
    @DisplayName("unusable requests")
    class UnusableRequests {

        @ParameterizedTest(name = "action=''{0}'' resource=''{1}'' is denied")
        @CsvSource(value = {
                "'', profile",
                "'  ', profile",
                "read, ''",
                "read, ':name'",
                "read, 'profile:'",
                "'profile:', profile",
                "NULL, profile",
                "read, NULL"
        }, nullValues = "NULL")
        void blankOrMalformedInputs(String action, String resource) {
            Principal principal = TestPrincipalFactory.withPermissions("profile:*");

            AuthorizationResult result = engine.evaluate(principal, action, resource);

            assertThat(result.decision()).isEqualTo(Decision.DENY);
            assertThat(result.basis()).isEqualTo(AuthorizationResult.Basis.INVALID_REQUEST);
        }

        @Test
        @DisplayName("a missing principal is denied, not thrown")
        void nullPrincipal() {
            assertThat(engine.authorize(null, "read", "profile")).isEqualTo(Decision.DENY);
        }
    }
}
