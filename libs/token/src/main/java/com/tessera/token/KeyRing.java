package com.tessera.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The process-wide set of signing and verification keys.
 * <p>
 * Readers always see one consistent snapshot: {@link #install} assembles a complete new
 * snapshot and publishes it with a single reference swap, so a concurrent validation observes
 * either the old ring or the new one, never a mix.
 */
public final class KeyRing {

    private static final Logger log = LoggerFactory.getLogger(KeyRing.class);

    private record Snapshot(SigningKey active, Map<String, VerificationKey> verificationKeys) {
    }

    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    /** A ring holding a single active key. */
    public static KeyRing of(SigningKey active) {
        KeyRing ring = new KeyRing();
        ring.install(active, List.of());
        return ring;
    }

    /**
     * Replaces the ring contents.
     *
     * @param active  the key new credentials are signed with
     * @param retired public keys of previous generations that remain valid for verification; an
     *                entry sharing the active key id is ignored
     */
    public void install(SigningKey active, Collection<VerificationKey> retired) {
        if (active == null) {
            throw new KeyInitializationException(KeyInitializationException.Kind.KEY_NOT_INITIALIZED,
                    "active signing key must not be null");
        }
        Map<String, VerificationKey> keys = new LinkedHashMap<>();
        keys.put(active.keyId(), active.verificationKey());
        for (VerificationKey key : retired) {
            keys.putIfAbsent(key.keyId(), key);
        }
        Snapshot previous = current.getAndSet(new Snapshot(active, Collections.unmodifiableMap(keys)));
        log.info("Installed key ring: active kid={}, verification kids={}{}", active.keyId(), keys.keySet(),
                previous == null ? "" : " (replaced active kid=" + previous.active().keyId() + ")");
    }

    /**
     * The key used to sign new credentials.
     *
     * @throws KeyInitializationException of kind {@code KEY_NOT_INITIALIZED} before the first install
     */
    public SigningKey activeKey() {
        return snapshot().active();
    }

    /** The verification key registered under {@code keyId}, if any. */
    public Optional<VerificationKey> verificationKey(String keyId) {
        return Optional.ofNullable(snapshot().verificationKeys().get(keyId));
    }

    public boolean isInitialized() {
        return current.get() != null;
    }

    /** All key ids currently accepted for verification, active key first. */
    public Set<String> keyIds() {
        Snapshot snapshot = current.get();
        return snapshot == null ? Set.of() : snapshot.verificationKeys().keySet();
    }

    private Snapshot snapshot() {
        Snapshot snapshot = current.get();
        if (snapshot == null) {
            throw new KeyInitializationException(KeyInitializationException.Kind.KEY_NOT_INITIALIZED,
                    "signing keys have not been loaded");
        }
        return snapshot;
    }
}
