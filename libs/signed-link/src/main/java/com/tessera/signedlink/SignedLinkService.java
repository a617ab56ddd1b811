package com.tessera.signedlink;

import com.tessera.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Generates and validates stateless, expiring, HMAC-SHA256 signed links.
 * <p>
 * The signature covers every parameter except {@code sig}, including {@code expires}, in the
 * canonical form {@code k1=v1&k2=v2} with keys sorted. Validation is stateless: a link stays
 * usable until it expires, there is no single-use tracking.
 */
public final class SignedLinkService {

    public static final String EXPIRES = "expires";
    public static final String SIGNATURE = "sig";

    private static final Logger log = LoggerFactory.getLogger(SignedLinkService.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final LinkSigningKey signingKey;
    private final Clock clock;
    private final SensitiveDataRedactor redactor;

    public SignedLinkService(LinkSigningKey signingKey) {
        this(signingKey, Clock.systemUTC(), new SensitiveDataRedactor());
    }

    public SignedLinkService(LinkSigningKey signingKey, Clock clock, SensitiveDataRedactor redactor) {
        this.signingKey = Objects.requireNonNull(signingKey, "signingKey");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.redactor = Objects.requireNonNull(redactor, "redactor");
    }

    /**
     * Builds a signed link.
     *
     * @param baseUrl URL without query string
     * @param params  caller parameters; must not use {@value #EXPIRES} or {@value #SIGNATURE}
     * @param ttl     lifetime from now
     * @return {@code baseUrl?query} with a form-encoded, key-sorted query
     */
    public String generate(String baseUrl, Map<String, String> params, Duration ttl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        Objects.requireNonNull(ttl, "ttl");
        SortedMap<String, String> values = new TreeMap<>();
        if (params != null) {
            params.forEach((name, value) -> {
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("parameter names must not be blank");
                }
                if (EXPIRES.equals(name) || SIGNATURE.equals(name)) {
                    throw new IllegalArgumentException("parameter name '%s' is reserved".formatted(name));
                }
                values.put(name, Objects.requireNonNull(value, () -> "value of " + name));
            });
        }
        long expires = clock.instant().plus(ttl).getEpochSecond();
        values.put(EXPIRES, Long.toString(expires));
        values.put(SIGNATURE, sign(values));

        StringJoiner query = new StringJoiner("&");
        values.forEach((name, value) -> query.add(formEncode(name) + "=" + formEncode(value)));
        log.debug("Generated signed link to {} expiring at {} with {}", baseUrl, expires, redactor.redact(values));
        return baseUrl + "?" + query;
    }

    /**
     * Validates link parameters.
     *
     * @return all parameters except {@value #SIGNATURE}, sorted by name
     * @throws SignedLinkException on the first failed check
     */
    public Map<String, String> validate(Map<String, String> values) {
        Map<String, String> present = values == null ? Map.of() : values;
        String expires = present.get(EXPIRES);
        String signature = present.get(SIGNATURE);
        if (expires == null || expires.isBlank() || signature == null || signature.isBlank()) {
            throw reject(SignedLinkException.Reason.MISSING_PARAMETERS, "missing required parameters", present);
        }
        long expiresAt;
        try {
            expiresAt = Long.parseLong(expires);
        } catch (NumberFormatException e) {
            throw reject(SignedLinkException.Reason.MALFORMED_EXPIRY, "invalid expires parameter", present);
        }
        if (clock.instant().getEpochSecond() > expiresAt) {
            throw reject(SignedLinkException.Reason.LINK_EXPIRED, "link expired", present);
        }

        SortedMap<String, String> unsigned = new TreeMap<>(present);
        unsigned.remove(SIGNATURE);
        byte[] expected = sign(unsigned).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8))) {
            throw reject(SignedLinkException.Reason.INVALID_SIGNATURE, "invalid signature", present);
        }
        return Collections.unmodifiableSortedMap(unsigned);
    }

    /**
     * Parses a raw form-encoded query string (with or without a leading {@code ?}) and validates
     * it. When a name repeats, its first value is used.
     *
     * @throws IllegalArgumentException when the query contains an invalid percent escape
     */
    public Map<String, String> validateQuery(String rawQuery) {
        return validate(parseQuery(rawQuery));
    }

    /**
     * Moves a signed link onto another base URL, keeping the query exactly as signed.
     *
     * @throws IllegalArgumentException when {@code signedUrl} is not a URL with a query
     */
    public static String toFrontendUrl(String signedUrl, String frontendBase) {
        if (frontendBase == null || frontendBase.isBlank()) {
            throw new IllegalArgumentException("frontendBase must not be blank");
        }
        if (signedUrl == null) {
            throw new IllegalArgumentException("signedUrl must not be null");
        }
        String rawQuery;
        try {
            rawQuery = new URI(signedUrl).getRawQuery();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("failed to parse signed URL", e);
        }
        if (rawQuery == null || rawQuery.isEmpty()) {
            throw new IllegalArgumentException("signed URL has no query");
        }
        return frontendBase + "?" + rawQuery;
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> values = new TreeMap<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return values;
        }
        String query = rawQuery.startsWith("?") ? rawQuery.substring(1) : rawQuery;
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = formDecode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : formDecode(pair.substring(eq + 1));
            values.putIfAbsent(name, value);
        }
        return values;
    }

    private String sign(SortedMap<String, String> values) {
        StringJoiner canonical = new StringJoiner("&");
        values.forEach((name, value) -> {
            if (!SIGNATURE.equals(name)) {
                canonical.add(name + "=" + value);
            }
        });
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey.current(), HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(canonical.toString().getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is unavailable", e);
        }
    }

    private SignedLinkException reject(SignedLinkException.Reason reason, String message, Map<String, String> values) {
        log.debug("Signed link rejected: {} {}", reason, redactor.redact(values));
        return new SignedLinkException(reason, message);
    }

    private static String formEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String formDecode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
