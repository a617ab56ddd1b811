package com.tessera.token;

import java.time.Duration;

/**
 * Fixed lifetimes per credential kind, set once when the {@link TokenService} is built.
 *
 * @param access   access token lifetime (minutes)
 * @param identity identity token lifetime (about an hour)
 * @param refresh  refresh token lifetime (days)
 */
public record TokenTtls(Duration access, Duration identity, Duration refresh) {

    public static final Duration DEFAULT_ACCESS = Duration.ofMinutes(15);
    public static final Duration DEFAULT_IDENTITY = Duration.ofHours(1);
    public static final Duration DEFAULT_REFRESH = Duration.ofDays(7);

    public TokenTtls {
        access = positiveOrDefault(access, DEFAULT_ACCESS, "access");
        identity = positiveOrDefault(identity, DEFAULT_IDENTITY, "identity");
        refresh = positiveOrDefault(refresh, DEFAULT_REFRESH, "refresh");
    }

    public static TokenTtls defaults() {
        return new TokenTtls(null, null, null);
    }

    /** The lifetime for the given kind. */
    public Duration forType(TokenType type) {
        return switch (type) {
            case ACCESS -> access;
            case IDENTITY -> identity;
            case REFRESH -> refresh;
        };
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero() || value.toSeconds() == 0) {
            throw new IllegalArgumentException(name + " TTL must be at least one second");
        }
        return value;
    }
}
