package com.tessera.security;

import java.util.Optional;

/**
 * A {@code family:name} value, used both for permission and policy patterns and for the
 * concrete action and resource being requested.
 * <p>
 * As a pattern, a name of {@value #WILDCARD} matches every name in the family. A requested
 * resource may be a bare family ({@code name == null}), which only wildcard patterns match.
 *
 * @param family the part before the first colon
 * @param name   the part after it, or null for a bare family
 */
public record ResourcePattern(String family, String name) {

    public static final String WILDCARD = "*";

    private static final char SEPARATOR = ':';

    /**
     * Parses a {@code family:name} value.
     *
     * @return empty when the value has no separator or a blank segment
     */
    public static Optional<ResourcePattern> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.strip();
        int sep = trimmed.indexOf(SEPARATOR);
        if (sep <= 0 || sep == trimmed.length() - 1) {
            return Optional.empty();
        }
        String family = trimmed.substring(0, sep).strip();
        String name = trimmed.substring(sep + 1).strip();
        if (family.isEmpty() || name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ResourcePattern(family, name));
    }

    /**
     * Parses a requested resource, which may be {@code family:name} or a bare {@code family}.
     */
    public static Optional<ResourcePattern> parseResource(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        if (value.indexOf(SEPARATOR) < 0) {
            return Optional.of(new ResourcePattern(value.strip(), null));
        }
        return parse(value);
    }

    /**
     * Normalises a requested action against the requested resource: a bare verb such as
     * {@code read} on resource {@code doc:readme} becomes {@code doc:read}; a qualified action
     * is parsed as is.
     */
    public static Optional<ResourcePattern> qualifyAction(String action, ResourcePattern resource) {
        if (action == null || action.isBlank() || resource == null) {
            return Optional.empty();
        }
        if (action.indexOf(SEPARATOR) >= 0) {
            return parse(action);
        }
        return Optional.of(new ResourcePattern(resource.family(), action.strip()));
    }

    /** True when this pattern covers {@code requested}. */
    public boolean matches(ResourcePattern requested) {
        if (requested == null || name == null || !family.equals(requested.family())) {
            return false;
        }
        return WILDCARD.equals(name) || name.equals(requested.name());
    }

    /** True when the raw pattern string covers {@code requested}; unparsable patterns match nothing. */
    public static boolean matches(String pattern, ResourcePattern requested) {
        return parse(pattern).map(p -> p.matches(requested)).orElse(false);
    }

    @Override
    public String toString() {
        return name == null ? family : family + SEPARATOR + name;
    }
}
