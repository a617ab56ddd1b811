package com.tessera.authservice.config;

import com.tessera.secrets.SecretsConfig;
import com.tessera.signedlink.LinkSigningKey;
import com.tessera.token.KeyMaterialNames;
import com.tessera.token.TokenService;
import com.tessera.token.TokenTtls;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Type-safe configuration bound from the {@code tessera.*} prefix and validated at startup.
 *
 * <pre>
 * tessera:
 *   service-name: auth-service
 *   secrets:
 *     backend: file
 *     file-path: /run/secrets
 *   keys:
 *     retired-public-keys: [JWT_PUBLIC_KEY_PREVIOUS]
 *   tokens:
 *     access-ttl: 15m
 *   links:
 *     api-base-url: https://api.example.com/v1/auth
 *     frontend-base-url: https://account.example.com
 * </pre>
 *
 * @param serviceName  service name used for logs and metric tags
 * @param environment  deployment environment, {@code development} by default
 * @param corsOrigins  browser origins allowed to call {@code /api/**}
 * @param secrets      secret backend selection
 * @param keys         secret names of the key material
 * @param tokens       credential lifetimes and clock skew
 * @param links        recovery link hosts and lifetimes
 */
@ConfigurationProperties(prefix = "tessera")
@Validated
public record TesseraProperties(
        @NotBlank String serviceName,
        String environment,
        List<String> corsOrigins,
        @Valid @NotNull Secrets secrets,
        @Valid @NotNull Keys keys,
        @Valid @NotNull Tokens tokens,
        @Valid @NotNull Links links) {

    public TesseraProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        corsOrigins = corsOrigins == null || corsOrigins.isEmpty()
                ? List.of("http://localhost:3000", "http://localhost:5173")
                : List.copyOf(corsOrigins);
        secrets = secrets == null ? new Secrets(null, null, null, null) : secrets;
        keys = keys == null ? new Keys(null, null, null, null, null) : keys;
        tokens = tokens == null ? new Tokens(null, null, null, null) : tokens;
    }

    /**
     * @param backend      {@code env}, {@code file}, {@code aws_ssm}, {@code aws_secrets} or {@code vault}
     * @param prefix       prepended to every secret name
     * @param filePath     base directory of the file backend
     * @param retryBackoff base delay between lookup attempts
     */
    public record Secrets(String backend, String prefix, String filePath, Duration retryBackoff) {

        public SecretsConfig toConfig() {
            return new SecretsConfig(backend, prefix, filePath, null, null, retryBackoff);
        }
    }

    /**
     * @param privateKey        secret name of the active PKCS#8 private key
     * @param publicKey         secret name of the active X.509 public key
     * @param retiredPublicKeys secret names of previous public keys still accepted
     * @param keyId             explicit kid of the active key, derived when blank
     * @param linkKey           secret name of the link HMAC key
     */
    public record Keys(String privateKey, String publicKey, List<String> retiredPublicKeys, String keyId,
                       String linkKey) {

        public Keys {
            retiredPublicKeys = retiredPublicKeys == null ? List.of() : List.copyOf(retiredPublicKeys);
            if (linkKey == null || linkKey.isBlank()) {
                linkKey = LinkSigningKey.DEFAULT_SECRET_NAME;
            }
        }

        public KeyMaterialNames toNames() {
            return new KeyMaterialNames(privateKey, publicKey, retiredPublicKeys, keyId);
        }
    }

    /**
     * @param accessTtl   access token lifetime
     * @param identityTtl identity token lifetime
     * @param refreshTtl  refresh token lifetime
     * @param clockSkew   tolerance for {@code iat}/{@code nbf} in the future
     */
    public record Tokens(Duration accessTtl, Duration identityTtl, Duration refreshTtl, Duration clockSkew) {

        public Tokens {
            if (clockSkew == null) {
                clockSkew = TokenService.DEFAULT_CLOCK_SKEW;
            }
        }

        public TokenTtls toTtls() {
            return new TokenTtls(accessTtl, identityTtl, refreshTtl);
        }
    }

    /**
     * @param apiBaseUrl             base of the API routes links are minted on
     * @param frontendBaseUrl        base of the account UI links are re-homed onto
     * @param passwordResetTtl       lifetime of password reset links
     * @param inviteTtl              lifetime of invitation links
     * @param emailVerificationTtl   lifetime of email verification links
     */
    public record Links(@NotBlank String apiBaseUrl, @NotBlank String frontendBaseUrl, Duration passwordResetTtl,
                        Duration inviteTtl, Duration emailVerificationTtl) {

        public Links {
            if (passwordResetTtl == null) {
                passwordResetTtl = Duration.ofHours(1);
            }
            if (inviteTtl == null) {
                inviteTtl = Duration.ofHours(72);
            }
            if (emailVerificationTtl == null) {
                emailVerificationTtl = Duration.ofHours(24);
            }
        }
    }
}
