package com.tessera.security;

public enum Decision {
    ALLOW,
    DENY
}
