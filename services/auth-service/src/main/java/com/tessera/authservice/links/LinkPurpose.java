package com.tessera.authservice.links;

/**
 * Account flows that send a signed link by email, with the route the link points at on both
 * the API host and the account UI.
 */
public enum LinkPurpose {

    PASSWORD_RESET("/reset-password"),
    INVITE("/register"),
    EMAIL_VERIFICATION("/verify-email");

    private final String path;

    LinkPurpose(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }
}
