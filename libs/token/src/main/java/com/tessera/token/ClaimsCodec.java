package com.tessera.token;

import com.nimbusds.jwt.JWTClaimsSet;

import java.text.ParseException;
import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Converts between {@link TokenClaims} and the JWT claim set. This is the only place claim
 * names appear.
 */
final class ClaimsCodec {

    static final String TOKEN_TYPE = "token_type";
    static final String SCOPE = "scope";
    static final String TENANT_ID = "tsr_tenant_id";
    static final String CLIENT_ID = "tsr_client_id";
    static final String PROVIDER_ID = "tsr_provider_id";
    static final String AUTH_TIME = "auth_time";
    static final String NONCE = "nonce";
    static final String EMAIL = "email";
    static final String EMAIL_VERIFIED = "email_verified";
    static final String PHONE = "phone";
    static final String PHONE_VERIFIED = "phone_verified";
    static final String FIRST_NAME = "first_name";
    static final String MIDDLE_NAME = "middle_name";
    static final String LAST_NAME = "last_name";
    static final String SUFFIX = "suffix";
    static final String BIRTHDATE = "birthdate";
    static final String GENDER = "gender";
    static final String ADDRESS = "address";
    static final String PICTURE = "picture";

    private static final List<String> PROFILE_CLAIMS = List.of(EMAIL, PHONE, FIRST_NAME, MIDDLE_NAME,
            LAST_NAME, SUFFIX, BIRTHDATE, GENDER, ADDRESS, PICTURE);

    private ClaimsCodec() {
        // utility class
    }

    static JWTClaimsSet encode(TokenClaims claims) {
        JWTClaimsSet.Builder builder = new JWTClaimsSet.Builder()
                .subject(claims.subject())
                .audience(claims.audience())
                .issuer(claims.issuer())
                .issueTime(Date.from(claims.issuedAt()))
                .notBeforeTime(Date.from(claims.notBefore()))
                .expirationTime(Date.from(claims.expiresAt()))
                .jwtID(claims.tokenId())
                .claim(TOKEN_TYPE, claims.tokenType().claimValue());

        if (claims.scope() != null) {
            builder.claim(SCOPE, claims.scope());
        }
        TenantScope tenant = claims.tenant();
        if (tenant != null) {
            putIfPresent(builder, TENANT_ID, tenant.tenantId());
            putIfPresent(builder, CLIENT_ID, tenant.clientId());
            putIfPresent(builder, PROVIDER_ID, tenant.providerId());
        }
        IdentityClaims identity = claims.identity();
        if (identity != null) {
            builder.claim(AUTH_TIME, identity.authTime().getEpochSecond());
            putIfPresent(builder, NONCE, identity.nonce());
            if (identity.profile() != null) {
                encodeProfile(builder, identity.profile());
            }
        }
        return builder.build();
    }

    private static void encodeProfile(JWTClaimsSet.Builder builder, UserProfile profile) {
        if (present(profile.email())) {
            builder.claim(EMAIL, profile.email());
            builder.claim(EMAIL_VERIFIED, profile.emailVerified());
        }
        if (present(profile.phone())) {
            builder.claim(PHONE, profile.phone());
            builder.claim(PHONE_VERIFIED, profile.phoneVerified());
        }
        putIfPresent(builder, FIRST_NAME, profile.firstName());
        putIfPresent(builder, MIDDLE_NAME, profile.middleName());
        putIfPresent(builder, LAST_NAME, profile.lastName());
        putIfPresent(builder, SUFFIX, profile.suffix());
        putIfPresent(builder, BIRTHDATE, profile.birthdate());
        putIfPresent(builder, GENDER, profile.gender());
        putIfPresent(builder, ADDRESS, profile.address());
        putIfPresent(builder, PICTURE, profile.picture());
    }

    /**
     * Reads a verified claim set.
     *
     * @throws TokenValidationException {@code MISSING_CLAIM} when a required claim is absent or blank,
     *                                  {@code MALFORMED_TOKEN} when a claim has the wrong JSON type
     *                                  or the token type is not recognised
     */
    static TokenClaims decode(JWTClaimsSet set) {
        try {
            String subject = required(set.getSubject(), "sub");
            List<String> audiences = set.getAudience();
            String audience = required(audiences.isEmpty() ? null : audiences.get(0), "aud");
            String issuer = required(set.getIssuer(), "iss");
            Date issuedAt = requiredDate(set.getIssueTime(), "iat");
            Date expiresAt = requiredDate(set.getExpirationTime(), "exp");
            String tokenId = required(set.getJWTID(), "jti");
            String typeValue = required(set.getStringClaim(TOKEN_TYPE), TOKEN_TYPE);
            TokenType type = TokenType.fromClaim(typeValue)
                    .orElseThrow(() -> new TokenValidationException(TokenValidationException.Reason.MALFORMED_TOKEN,
                            "unrecognised token_type"));
            Date notBefore = set.getNotBeforeTime();

            String scope = null;
            TenantScope tenant = null;
            IdentityClaims identity = null;
            switch (type) {
                case ACCESS -> {
                    scope = required(set.getStringClaim(SCOPE), SCOPE);
                    tenant = decodeTenant(set);
                }
                case IDENTITY -> identity = decodeIdentity(set);
                case REFRESH -> {
                    // standard claims only
                }
            }
            return new TokenClaims(subject, audience, issuer, issuedAt.toInstant(),
                    notBefore == null ? null : notBefore.toInstant(), expiresAt.toInstant(),
                    tokenId, type, scope, tenant, identity);
        } catch (ParseException e) {
            throw new TokenValidationException(TokenValidationException.Reason.MALFORMED_TOKEN,
                    "claim has an unexpected type", e);
        }
    }

    private static TenantScope decodeTenant(JWTClaimsSet set) throws ParseException {
        TenantScope tenant = new TenantScope(set.getStringClaim(TENANT_ID), set.getStringClaim(CLIENT_ID),
                set.getStringClaim(PROVIDER_ID));
        return tenant.isEmpty() ? null : tenant;
    }

    private static IdentityClaims decodeIdentity(JWTClaimsSet set) throws ParseException {
        Long authTime = set.getLongClaim(AUTH_TIME);
        UserProfile profile = null;
        if (PROFILE_CLAIMS.stream().anyMatch(name -> set.getClaim(name) != null)) {
            profile = new UserProfile(
                    set.getStringClaim(EMAIL),
                    Boolean.TRUE.equals(set.getBooleanClaim(EMAIL_VERIFIED)),
                    set.getStringClaim(PHONE),
                    Boolean.TRUE.equals(set.getBooleanClaim(PHONE_VERIFIED)),
                    set.getStringClaim(FIRST_NAME),
                    set.getStringClaim(MIDDLE_NAME),
                    set.getStringClaim(LAST_NAME),
                    set.getStringClaim(SUFFIX),
                    set.getStringClaim(BIRTHDATE),
                    set.getStringClaim(GENDER),
                    set.getStringClaim(ADDRESS),
                    set.getStringClaim(PICTURE));
        }
        return new IdentityClaims(authTime == null ? null : Instant.ofEpochSecond(authTime),
                set.getStringClaim(NONCE), profile);
    }

    private static String required(String value, String claim) {
        if (value == null || value.isBlank()) {
            throw missing(claim);
        }
        return value;
    }

    private static Date requiredDate(Date value, String claim) {
        if (value == null) {
            throw missing(claim);
        }
        return value;
    }

    private static TokenValidationException missing(String claim) {
        return new TokenValidationException(TokenValidationException.Reason.MISSING_CLAIM,
                "required claim '%s' is missing".formatted(claim));
    }

    private static void putIfPresent(JWTClaimsSet.Builder builder, String name, String value) {
        if (present(value)) {
            builder.claim(name, value);
        }
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
