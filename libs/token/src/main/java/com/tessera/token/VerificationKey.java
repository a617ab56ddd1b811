package com.tessera.token;

import java.security.interfaces.RSAPublicKey;

/**
 * A public key accepted for verification under a given {@code kid}.
 */
public record VerificationKey(String keyId, RSAPublicKey publicKey) {

    public VerificationKey {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId must not be blank");
        }
        if (publicKey == null) {
            throw new IllegalArgumentException("publicKey must not be null");
        }
        SigningKey.requireStrength(publicKey, keyId);
    }

    /** A verification key identified by the fingerprint of the public key. */
    public static VerificationKey of(RSAPublicKey publicKey) {
        return new VerificationKey(SigningKey.fingerprint(publicKey), publicKey);
    }

    @Override
    public String toString() {
        return "VerificationKey[keyId=" + keyId + "]";
    }
}
