package com.tessera.token;

import java.util.List;

/**
 * Secret names under which the key ring's PEM material is stored.
 *
 * @param privateKey       PKCS#8 private key of the active generation
 * @param publicKey        X.509 public key of the active generation
 * @param retiredPublicKeys X.509 public keys of previous generations, still accepted for verification
 * @param keyId            explicit {@code kid} for the active key; blank derives it from the public key
 */
public record KeyMaterialNames(String privateKey, String publicKey, List<String> retiredPublicKeys, String keyId) {

    public static final String DEFAULT_PRIVATE_KEY = "JWT_PRIVATE_KEY";
    public static final String DEFAULT_PUBLIC_KEY = "JWT_PUBLIC_KEY";

    public KeyMaterialNames {
        if (privateKey == null || privateKey.isBlank()) {
            privateKey = DEFAULT_PRIVATE_KEY;
        }
        if (publicKey == null || publicKey.isBlank()) {
            publicKey = DEFAULT_PUBLIC_KEY;
        }
        retiredPublicKeys = retiredPublicKeys == null ? List.of() : List.copyOf(retiredPublicKeys);
        keyId = keyId == null ? "" : keyId.strip();
    }

    public static KeyMaterialNames defaults() {
        return new KeyMaterialNames(null, null, List.of(), null);
    }

    public boolean hasExplicitKeyId() {
        return !keyId.isEmpty();
    }
}
