package com.tessera.token;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;

/**
 * One RSA key generation used to sign new credentials.
 *
 * @param keyId      value of the {@code kid} header for tokens signed with this key
 * @param privateKey the signing key
 * @param publicKey  the matching verification key
 */
public record SigningKey(String keyId, RSAPrivateKey privateKey, RSAPublicKey publicKey) {

    /** Minimum accepted RSA modulus length. */
    public static final int MIN_KEY_BITS = 2048;

    public SigningKey {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId must not be blank");
        }
        if (privateKey == null || publicKey == null) {
            throw new KeyInitializationException(KeyInitializationException.Kind.KEY_NOT_INITIALIZED,
                    "signing key %s is incomplete".formatted(keyId));
        }
        requireStrength(publicKey, keyId);
        if (!privateKey.getModulus().equals(publicKey.getModulus())
                || (privateKey instanceof RSAPrivateCrtKey crt
                        && !crt.getPublicExponent().equals(publicKey.getPublicExponent()))) {
            throw new KeyInitializationException(KeyInitializationException.Kind.KEY_MISMATCH,
                    "private and public keys of %s do not form a valid key pair".formatted(keyId));
        }
    }

    /** Creates a signing key identified by the fingerprint of its public key. */
    public static SigningKey of(RSAPrivateKey privateKey, RSAPublicKey publicKey) {
        return new SigningKey(fingerprint(publicKey), privateKey, publicKey);
    }

    /** The verification half of this key. */
    public VerificationKey verificationKey() {
        return new VerificationKey(keyId, publicKey);
    }

    /**
     * A stable key id derived from the public key: the first 8 characters of the unpadded
     * base64url SHA-256 digest of its X.509 encoding.
     */
    public static String fingerprint(RSAPublicKey publicKey) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(publicKey.getEncoded());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    static void requireStrength(RSAPublicKey publicKey, String keyId) {
        int bits = publicKey.getModulus().bitLength();
        if (bits < MIN_KEY_BITS) {
            throw new KeyInitializationException(KeyInitializationException.Kind.INVALID_KEY,
                    "RSA key %s is %d bits, below the required %d bits".formatted(keyId, bits, MIN_KEY_BITS));
        }
    }

    @Override
    public String toString() {
        return "SigningKey[keyId=" + keyId + "]";
    }
}
