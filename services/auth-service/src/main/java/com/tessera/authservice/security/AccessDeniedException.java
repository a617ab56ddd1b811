package com.tessera.authservice.security;

/**
 * An authenticated caller is not allowed to perform the requested action.
 */
public class AccessDeniedException extends RuntimeException {

    private final String action;
    private final String resource;

    public AccessDeniedException(String action, String resource) {
        super("Access denied: %s on %s".formatted(action, resource));
        this.action = action;
        this.resource = resource;
    }

    public String action() {
        return action;
    }

    public String resource() {
        return resource;
    }
}
