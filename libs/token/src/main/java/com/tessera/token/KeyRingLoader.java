package com.tessera.token;

import com.tessera.secrets.SecretResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads PEM key material through a {@link SecretResolver} and installs it into a {@link KeyRing}.
 * <p>
 * Every key is read and checked before the ring is touched, so a failed reload leaves the
 * previously installed keys in service.
 */
public final class KeyRingLoader {

    private static final Logger log = LoggerFactory.getLogger(KeyRingLoader.class);

    private final SecretResolver secrets;

    public KeyRingLoader(SecretResolver secrets) {
        this.secrets = Objects.requireNonNull(secrets, "secrets");
    }

    /**
     * Reads all key material named by {@code names} and swaps it into {@code ring}.
     *
     * @return the newly active signing key
     * @throws KeyInitializationException when a key is unreadable, too weak or mismatched
     * @throws com.tessera.secrets.SecretResolutionException when a secret cannot be resolved
     */
    public SigningKey load(KeyRing ring, KeyMaterialNames names) {
        SigningKey active = readSigningKey(names);
        List<VerificationKey> retired = new ArrayList<>();
        for (String name : names.retiredPublicKeys()) {
            VerificationKey key = VerificationKey.of(PemKeys.readPublicKey(secrets.getSecretString(name)));
            log.info("Loaded retired verification key {} as kid={}", name, key.keyId());
            retired.add(key);
        }
        ring.install(active, retired);
        return active;
    }

    /** Reads and pairs the active private and public key. */
    public SigningKey readSigningKey(KeyMaterialNames names) {
        RSAPrivateKey privateKey = PemKeys.readPrivateKey(secrets.getSecretString(names.privateKey()));
        RSAPublicKey publicKey = PemKeys.readPublicKey(secrets.getSecretString(names.publicKey()));
        SigningKey key = names.hasExplicitKeyId()
                ? new SigningKey(names.keyId(), privateKey, publicKey)
                : SigningKey.of(privateKey, publicKey);
        log.info("Loaded signing key kid={} ({} bits)", key.keyId(), publicKey.getModulus().bitLength());
        return key;
    }
}
