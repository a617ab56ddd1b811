package com.tessera.secrets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EnvironmentSecretProvider")
class EnvironmentSecretProviderTest {

    @Test
    @DisplayName("returns plain values as UTF-8 bytes")
    void plainValue() {
        var provider = new EnvironmentSecretProvider(Map.of("LINK_KEY", "hunter2")::get);

        assertThat(provider.getSecret("LINK_KEY")).isEqualTo("hunter2".getBytes(StandardCharsets.UTF_8));
        assertThat(provider.getSecretString("LINK_KEY")).isEqualTo("hunter2");
    }

    @Test
    @DisplayName("decodes values carrying the base64: prefix")
    void base64Value() {
        byte[] binary = {0, 1, 2, (byte) 0xff};
        String encoded = EnvironmentSecretProvider.BASE64_PREFIX + Base64.getEncoder().encodeToString(binary);
        var provider = new EnvironmentSecretProvider(Map.of("BIN", encoded)::get);

        assertThat(provider.getSecret("BIN")).containsExactly(binary);
    }

    @Test
    @DisplayName("unset variable is SECRET_UNAVAILABLE")
    void unsetVariable() {
        var provider = new EnvironmentSecretProvider(Map.<String, String>of()::get);

        assertThatThrownBy(() -> provider.getSecret("MISSING"))
                .isInstanceOfSatisfying(SecretResolutionException.class, e -> {
                    assertThat(e.kind()).isEqualTo(SecretResolutionException.Kind.SECRET_UNAVAILABLE);
                    assertThat(e.secretName()).isEqualTo("MISSING");
                });
    }

    @Test
    @DisplayName("invalid base64 payload is rejected without echoing the value")
    void invalidBase64() {
        var provider = new EnvironmentSecretProvider(Map.of("BAD", "base64:***not-base64***")::get);

        assertThatThrownBy(() -> provider.getSecret("BAD"))
                .isInstanceOf(SecretResolutionException.class)
                .hasMessageNotContaining("not-base64");
    }
}
