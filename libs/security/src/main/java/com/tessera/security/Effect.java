package com.tessera.security;

import java.util.Optional;

/** Effect of a policy statement. */
public enum Effect {

    ALLOW("allow"),
    DENY("deny");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    /** The JSON value, {@code "allow"} or {@code "deny"}. */
    public String value() {
        return value;
    }

    public static Optional<Effect> fromValue(String value) {
        for (Effect effect : values()) {
            if (effect.value.equals(value)) {
                return Optional.of(effect);
            }
        }
        return Optional.empty();
    }
}
