package com.tessera.signedlink;

import com.tessera.secrets.SecretResolver;
import com.tessera.secrets.SecretsConfig;
import com.tessera.secrets.EnvironmentSecretProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LinkSigningKey")
class LinkSigningKeyTest {

    @Test
    @DisplayName("rejects keys shorter than 32 bytes")
    void rejectsShortKeys() {
        assertThatThrownBy(() -> LinkSigningKey.of("short".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32");
    }

    @Test
    @DisplayName("copies the key so later mutation has no effect")
    void copiesOnInstall() {
        byte[] material = new byte[32];
        LinkSigningKey key = LinkSigningKey.of(material);

        material[0] = 7;

        assertThat(key.current()[0]).isZero();
    }

    @Test
    @DisplayName("loads the key through the secret resolver")
    void loadsFromSecrets() {
        byte[] material = new byte[48];
        material[5] = 1;
        Map<String, String> env = Map.of("SIGNED_LINK_KEY", "base64:" + Base64.getEncoder().encodeToString(material));
        SecretResolver secrets = new SecretResolver(new EnvironmentSecretProvider(env::get), SecretsConfig.defaults());
        LinkSigningKey key = new LinkSigningKey();

        key.load(secrets, LinkSigningKey.DEFAULT_SECRET_NAME);

        assertThat(key.isInitialized()).isTrue();
        assertThat(key.current()).isEqualTo(material);
    }
}
