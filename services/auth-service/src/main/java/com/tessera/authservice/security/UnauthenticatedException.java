package com.tessera.authservice.security;

/**
 * The request carried no usable credential. The message is deliberately generic; the
 * underlying reason is only logged.
 */
public class UnauthenticatedException extends RuntimeException {

    public static final String MESSAGE = "Invalid or expired credentials";

    public UnauthenticatedException() {
        super(MESSAGE);
    }
}
