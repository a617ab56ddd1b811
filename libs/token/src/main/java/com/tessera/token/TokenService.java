package com.tessera.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Issues and validates RS256-signed credentials.
 * <p>
 * Issuance signs with the {@link KeyRing}'s active key and stamps its id into the {@code kid}
 * header. Validation runs the checks in a fixed order and reports the first failure as a
 * {@link TokenValidationException}:
 * <ol>
 *   <li>structure ({@code MALFORMED_TOKEN})</li>
 *   <li>algorithm must be exactly RS256, before any key lookup ({@code UNSUPPORTED_ALGORITHM})</li>
 *   <li>{@code kid} must name a known key; no {@code kid} means the active key ({@code UNKNOWN_KEY})</li>
 *   <li>signature ({@code INVALID_SIGNATURE})</li>
 *   <li>required claims ({@code MISSING_CLAIM})</li>
 *   <li>{@code exp} strictly after now ({@code EXPIRED_TOKEN})</li>
 *   <li>{@code nbf} and {@code iat} no later than now plus clock skew ({@code NOT_YET_VALID})</li>
 *   <li>expected type, when given ({@code TOKEN_TYPE_MISMATCH})</li>
 * </ol>
 * Instances are thread-safe.
 */
public final class TokenService {

    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(60);

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);
    private static final int TOKEN_ID_BYTES = 16;

    private final KeyRing keyRing;
    private final TokenTtls ttls;
    private final Duration clockSkew;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public TokenService(KeyRing keyRing) {
        this(keyRing, TokenTtls.defaults(), DEFAULT_CLOCK_SKEW, Clock.systemUTC());
    }

    public TokenService(KeyRing keyRing, TokenTtls ttls, Duration clockSkew, Clock clock) {
        this.keyRing = Objects.requireNonNull(keyRing, "keyRing");
        this.ttls = Objects.requireNonNull(ttls, "ttls");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (clockSkew == null || clockSkew.isNegative()) {
            throw new IllegalArgumentException("clock skew must not be negative");
        }
        this.clockSkew = clockSkew;
    }

    public TokenTtls ttls() {
        return ttls;
    }

    // ---- issuance ----

    public String issueAccessToken(String subject, String audience, String issuer, String scope) {
        return issueAccessToken(subject, audience, issuer, scope, null);
    }

    /**
     * Issues an access token.
     *
     * @param tenant optional tenant scope; absent components are not emitted
     */
    public String issueAccessToken(String subject, String audience, String issuer, String scope,
                                   TenantScope tenant) {
        requireText(scope, "scope");
        return sign(standardClaims(TokenType.ACCESS, subject, audience, issuer, scope,
                tenant == null || tenant.isEmpty() ? null : tenant, null));
    }

    /**
     * Issues an identity token with {@code auth_time} set to now.
     *
     * @param profile optional profile; only non-blank fields are emitted
     * @param nonce   optional nonce; emitted only when non-blank
     */
    public String issueIdentityToken(String subject, String audience, String issuer, UserProfile profile,
                                     String nonce) {
        Instant now = now();
        IdentityClaims identity = new IdentityClaims(now, nonce == null || nonce.isBlank() ? null : nonce, profile);
        return sign(standardClaims(TokenType.IDENTITY, subject, audience, issuer, null, null, identity, now));
    }

    public String issueRefreshToken(String subject, String audience, String issuer) {
        return sign(standardClaims(TokenType.REFRESH, subject, audience, issuer, null, null, null));
    }

    /**
     * Issues access, identity and refresh tokens for one sign-in.
     */
    public TokenBundle issueBundle(String subject, String audience, String issuer, String scope,
                                   TenantScope tenant, UserProfile profile, String nonce) {
        String access = issueAccessToken(subject, audience, issuer, scope, tenant);
        String identity = issueIdentityToken(subject, audience, issuer, profile, nonce);
        String refresh = issueRefreshToken(subject, audience, issuer);
        return new TokenBundle(access, identity, refresh, ttls.access().toSeconds(), TokenBundle.BEARER, now());
    }

    /**
     * Exchanges a refresh token for a new bundle with a rotated refresh token.
     *
     * @throws TokenValidationException when the presented token is not a valid refresh token
     */
    public TokenBundle refresh(String refreshToken, String scope, TenantScope tenant, UserProfile profile) {
        TokenClaims presented = validate(refreshToken, TokenType.REFRESH);
        log.debug("Refreshing credentials for sub={} (previous jti={})", presented.subject(), presented.tokenId());
        return issueBundle(presented.subject(), presented.audience(), presented.issuer(), scope, tenant, profile, null);
    }

    // ---- validation ----

    /** Validates a credential of any type. */
    public TokenClaims validate(String token) {
        return validate(token, null);
    }

    /**
     * Validates a credential.
     *
     * @param expectedType required type, or null to accept any
     * @throws TokenValidationException on the first failed check
     */
    public TokenClaims validate(String token, TokenType expectedType) {
        try {
            TokenClaims claims = verify(token);
            if (expectedType != null && claims.tokenType() != expectedType) {
                throw new TokenValidationException(TokenValidationException.Reason.TOKEN_TYPE_MISMATCH,
                        "expected %s but got %s".formatted(expectedType.claimValue(), claims.tokenType().claimValue()));
            }
            return claims;
        } catch (TokenValidationException e) {
            log.debug("Token rejected: {} ({})", e.reason(), e.getMessage());
            throw e;
        }
    }

    private TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(TokenValidationException.Reason.MALFORMED_TOKEN, "token is empty");
        }
        SignedJWT jwt;
        JWTClaimsSet claimSet;
        try {
            jwt = SignedJWT.parse(token.strip());
        } catch (ParseException e) {
            throw new TokenValidationException(TokenValidationException.Reason.MALFORMED_TOKEN,
                    "token is not a signed JWT", e);
        }

        JWSHeader header = jwt.getHeader();
        if (!JWSAlgorithm.RS256.equals(header.getAlgorithm())) {
            throw new TokenValidationException(TokenValidationException.Reason.UNSUPPORTED_ALGORITHM,
                    "unsupported signing algorithm " + header.getAlgorithm());
        }

        VerificationKey key = resolveKey(header.getKeyID());
        try {
            if (!jwt.verify(new RSASSAVerifier(key.publicKey()))) {
                throw new TokenValidationException(TokenValidationException.Reason.INVALID_SIGNATURE,
                        "signature verification failed");
            }
        } catch (JOSEException e) {
            throw new TokenValidationException(TokenValidationException.Reason.INVALID_SIGNATURE,
                    "signature verification failed", e);
        }

        try {
            claimSet = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new TokenValidationException(TokenValidationException.Reason.MALFORMED_TOKEN,
                    "claims are not a JSON object", e);
        }
        TokenClaims claims = ClaimsCodec.decode(claimSet);
        checkTimes(claims);
        return claims;
    }

    private VerificationKey resolveKey(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            return keyRing.activeKey().verificationKey();
        }
        return keyRing.verificationKey(keyId)
                .orElseThrow(() -> new TokenValidationException(TokenValidationException.Reason.UNKNOWN_KEY,
                        "no verification key for kid " + keyId));
    }

    private void checkTimes(TokenClaims claims) {
        Instant now = clock.instant();
        if (!claims.expiresAt().isAfter(now)) {
            throw new TokenValidationException(TokenValidationException.Reason.EXPIRED_TOKEN,
                    "token expired at " + claims.expiresAt());
        }
        Instant latestAcceptable = now.plus(clockSkew);
        if (claims.issuedAt().isAfter(latestAcceptable)
                || (claims.notBefore() != null && claims.notBefore().isAfter(latestAcceptable))) {
            throw new TokenValidationException(TokenValidationException.Reason.NOT_YET_VALID,
                    "token is not valid before " + (claims.notBefore() != null ? claims.notBefore() : claims.issuedAt()));
        }
    }

    // ---- internals ----

    private TokenClaims standardClaims(TokenType type, String subject, String audience, String issuer,
                                       String scope, TenantScope tenant, IdentityClaims identity) {
        return standardClaims(type, subject, audience, issuer, scope, tenant, identity, now());
    }

    private TokenClaims standardClaims(TokenType type, String subject, String audience, String issuer,
                                       String scope, TenantScope tenant, IdentityClaims identity, Instant now) {
        requireText(subject, "subject");
        requireText(audience, "audience");
        requireText(issuer, "issuer");
        return new TokenClaims(subject, audience, issuer, now, now, now.plus(ttls.forType(type)),
                newTokenId(), type, scope, tenant, identity);
    }

    private String sign(TokenClaims claims) {
        SigningKey key = keyRing.activeKey();
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.RS256)
                .keyID(key.keyId())
                .type(JOSEObjectType.JWT)
                .build();
        SignedJWT jwt = new SignedJWT(header, ClaimsCodec.encode(claims));
        try {
            jwt.sign(new RSASSASigner(key.privateKey()));
        } catch (JOSEException e) {
            throw new IllegalStateException("failed to sign " + claims.tokenType().claimValue(), e);
        }
        log.debug("Issued {} jti={} sub={} kid={}", claims.tokenType().claimValue(), claims.tokenId(),
                claims.subject(), key.keyId());
        return jwt.serialize();
    }

    private String newTokenId() {
        byte[] bytes = new byte[TOKEN_ID_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
