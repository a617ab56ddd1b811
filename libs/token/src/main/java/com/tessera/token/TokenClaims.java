package com.tessera.token;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * The verified content of a credential.
 * <p>
 * Standard fields are always present. The type-specific parts are populated according to
 * {@link #tokenType()}: {@code scope} and {@code tenant} for access tokens, {@code identity} for
 * identity tokens, nothing extra for refresh tokens.
 *
 * @param subject   {@code sub}
 * @param audience  {@code aud}, the client identifier
 * @param issuer    {@code iss}, the tenant-scoped authority URL
 * @param issuedAt  {@code iat}
 * @param notBefore {@code nbf}
 * @param expiresAt {@code exp}
 * @param tokenId   {@code jti}
 * @param tokenType {@code token_type}
 * @param scope     access token scope string, otherwise null
 * @param tenant    access token tenant scope, otherwise null
 * @param identity  identity token claims, otherwise null
 */
public record TokenClaims(
        String subject,
        String audience,
        String issuer,
        Instant issuedAt,
        Instant notBefore,
        Instant expiresAt,
        String tokenId,
        TokenType tokenType,
        String scope,
        TenantScope tenant,
        IdentityClaims identity
) {

    /** {@code exp - iat}. */
    public Duration lifetime() {
        return Duration.between(issuedAt, expiresAt);
    }

    public Optional<String> scopeValue() {
        return Optional.ofNullable(scope);
    }

    public Optional<TenantScope> tenantScope() {
        return Optional.ofNullable(tenant);
    }

    public Optional<IdentityClaims> identityClaims() {
        return Optional.ofNullable(identity);
    }

    /** The tenant id from the tenant scope, if the token carries one. */
    public Optional<String> tenantId() {
        return tenantScope().map(TenantScope::tenantId);
    }
}
