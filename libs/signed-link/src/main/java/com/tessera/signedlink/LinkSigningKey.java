package com.tessera.signedlink;

import com.tessera.secrets.SecretResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the HMAC key used to sign links.
 * <p>
 * The key is copied on install and on read, so callers can neither mutate the installed key
 * nor observe a half-replaced one.
 */
public final class LinkSigningKey {

    /** Minimum accepted key length in bytes. */
    public static final int MIN_KEY_BYTES = 32;

    public static final String DEFAULT_SECRET_NAME = "SIGNED_LINK_KEY";

    private static final Logger log = LoggerFactory.getLogger(LinkSigningKey.class);

    private final AtomicReference<byte[]> key = new AtomicReference<>();

    public static LinkSigningKey of(byte[] key) {
        LinkSigningKey holder = new LinkSigningKey();
        holder.install(key);
        return holder;
    }

    /**
     * Replaces the signing key. Links signed with the previous key stop validating.
     *
     * @throws IllegalArgumentException when the key is shorter than {@value #MIN_KEY_BYTES} bytes
     */
    public void install(byte[] newKey) {
        if (newKey == null || newKey.length < MIN_KEY_BYTES) {
            throw new IllegalArgumentException("link signing key must be at least %d bytes".formatted(MIN_KEY_BYTES));
        }
        key.set(Arrays.copyOf(newKey, newKey.length));
        log.info("Installed link signing key ({} bytes)", newKey.length);
    }

    /** Resolves the key through {@code secrets} and installs it. */
    public void load(SecretResolver secrets, String secretName) {
        install(secrets.getSecret(secretName));
    }

    public boolean isInitialized() {
        return key.get() != null;
    }

    byte[] current() {
        byte[] current = key.get();
        if (current == null) {
            throw new IllegalStateException("link signing key has not been loaded");
        }
        return current.clone();
    }
}
