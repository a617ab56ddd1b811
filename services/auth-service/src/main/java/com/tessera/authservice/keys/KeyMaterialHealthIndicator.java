package com.tessera.authservice.keys;

import com.tessera.signedlink.LinkSigningKey;
import com.tessera.token.KeyRing;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports {@code keyMaterial} as UP once both the key ring and the link key are loaded.
 * Details list key ids only.
 */
@Component
public class KeyMaterialHealthIndicator implements HealthIndicator {

    private final KeyRing keyRing;
    private final LinkSigningKey linkSigningKey;
    private final KeyMaterialLoader loader;

    public KeyMaterialHealthIndicator(KeyRing keyRing, LinkSigningKey linkSigningKey, KeyMaterialLoader loader) {
        this.keyRing = keyRing;
        this.linkSigningKey = linkSigningKey;
        this.loader = loader;
    }

    @Override
    public Health health() {
        if (!keyRing.isInitialized() || !linkSigningKey.isInitialized()) {
            return Health.down()
                    .withDetail("keyRing", keyRing.isInitialized())
                    .withDetail("linkKey", linkSigningKey.isInitialized())
                    .build();
        }
        Health.Builder builder = Health.up()
                .withDetail("activeKeyId", keyRing.activeKey().keyId())
                .withDetail("verificationKeyIds", keyRing.keyIds());
        loader.lastLoad().ifPresent(load -> builder.withDetail("loadedAt", load.loadedAt().toString()));
        return builder.build();
    }
}
