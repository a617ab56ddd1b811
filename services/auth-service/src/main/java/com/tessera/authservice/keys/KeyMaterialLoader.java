package com.tessera.authservice.keys;

import com.tessera.authservice.config.TesseraProperties;
import com.tessera.observability.SecurityMetrics;
import com.tessera.secrets.SecretResolutionException;
import com.tessera.secrets.SecretResolver;
import com.tessera.signedlink.LinkSigningKey;
import com.tessera.token.KeyInitializationException;
import com.tessera.token.KeyRing;
import com.tessera.token.KeyRingLoader;
import com.tessera.token.SigningKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the token key ring and the link signing key through secret resolution.
 * <p>
 * Runs once while the application context starts, where any failure aborts startup, and again
 * on an explicit administrative reload, where a failure keeps the previous keys in service.
 * Reloads are serialized; request handling never waits on them.
 */
@Component
public class KeyMaterialLoader implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(KeyMaterialLoader.class);

    private final KeyRingLoader keyRingLoader;
    private final SecretResolver secrets;
    private final KeyRing keyRing;
    private final LinkSigningKey linkSigningKey;
    private final TesseraProperties.Keys keys;
    private final SecurityMetrics metrics;
    private final Clock clock;
    private final AtomicReference<KeyReloadResult> lastLoad = new AtomicReference<>();

    public KeyMaterialLoader(SecretResolver secrets, KeyRing keyRing, LinkSigningKey linkSigningKey,
                             TesseraProperties properties, SecurityMetrics metrics, Clock clock) {
        this.keyRingLoader = new KeyRingLoader(secrets);
        this.secrets = secrets;
        this.keyRing = keyRing;
        this.linkSigningKey = linkSigningKey;
        this.keys = properties.keys();
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void afterPropertiesSet() {
        KeyReloadResult result = reload();
        log.info("Key material ready: active kid={}, accepted kids={}", result.activeKeyId(),
                result.verificationKeyIds());
    }

    /**
     * Re-reads all key material and swaps it in.
     *
     * @throws KeyInitializationException  when key material is invalid
     * @throws SecretResolutionException   when a secret cannot be resolved
     * @throws IllegalArgumentException    when the link key is too short
     */
    public synchronized KeyReloadResult reload() {
        long started = System.nanoTime();
        String outcome = "failure";
        try {
            byte[] linkKey = secrets.getSecret(keys.linkKey());
            if (linkKey.length < LinkSigningKey.MIN_KEY_BYTES) {
                throw new IllegalArgumentException("link signing key %s must be at least %d bytes"
                        .formatted(keys.linkKey(), LinkSigningKey.MIN_KEY_BYTES));
            }
            SigningKey active = keyRingLoader.load(keyRing, keys.toNames());
            linkSigningKey.install(linkKey);
            metrics.secretResolution("resolved");
            KeyReloadResult result = new KeyReloadResult(active.keyId(), List.copyOf(keyRing.keyIds()),
                    clock.instant());
            lastLoad.set(result);
            outcome = "success";
            return result;
        } catch (SecretResolutionException e) {
            metrics.secretResolution(e.kind().name());
            log.error("Key material could not be resolved: {}", e.getMessage());
            throw e;
        } catch (KeyInitializationException e) {
            log.error("Key material is invalid ({}): {}", e.kind(), e.getMessage());
            throw e;
        } finally {
            metrics.keyReload(outcome).record(Duration.ofNanos(System.nanoTime() - started));
        }
    }

    /** The most recent successful load, if any. */
    public Optional<KeyReloadResult> lastLoad() {
        return Optional.ofNullable(lastLoad.get());
    }
}
