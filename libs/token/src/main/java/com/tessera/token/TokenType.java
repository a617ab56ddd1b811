package com.tessera.token;

import java.util.Optional;

/**
 * Credential kinds issued by {@link TokenService}, with the value carried in the
 * {@code token_type} claim.
 */
public enum TokenType {

    ACCESS("access_token"),
    IDENTITY("id_token"),
    REFRESH("refresh_token");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    /** The wire value of the {@code token_type} claim (e.g. {@code "access_token"}). */
    public String claimValue() {
        return claimValue;
    }

    /**
     * Looks up a type by its claim value.
     *
     * @return the matching type, or empty for unknown or null values
     */
    public static Optional<TokenType> fromClaim(String value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
