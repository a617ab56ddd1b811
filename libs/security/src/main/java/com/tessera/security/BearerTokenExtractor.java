package com.tessera.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer credentials from an Authorization header, falling back to the
 * {@value #ACCESS_TOKEN_COOKIE} cookie used by browser sessions.
 */
public final class BearerTokenExtractor {

    /** Name of the cookie carrying the access token for browser clients. */
    public static final String ACCESS_TOKEN_COOKIE = "access_token";

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the token from a {@code Bearer <token>} header value. The scheme is matched
     * case-insensitively and must be followed by whitespace.
     *
     * @return the token, or empty if the header is missing or malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /**
     * Extracts the token from the header, or from the cookie value when the header carries none.
     */
    public static Optional<String> extract(String authorizationHeader, String accessTokenCookie) {
        Optional<String> fromHeader = extract(authorizationHeader);
        if (fromHeader.isPresent()) {
            return fromHeader;
        }
        if (accessTokenCookie == null || accessTokenCookie.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(accessTokenCookie.strip());
    }
}
