package com.tessera.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Nested
    @DisplayName("valid headers")
    class ValidHeaders {

        @Test
        @DisplayName("extracts token from 'Bearer xxx' header")
        void extractsToken() {
            assertThat(BearerTokenExtractor.extract("Bearer eyJhbGciOiJSUzI1NiJ9.payload.sig"))
                    .contains("eyJhbGciOiJSUzI1NiJ9.payload.sig");
        }

        @Test
        @DisplayName("matches the scheme case-insensitively and tolerates extra whitespace")
        void lenientScheme() {
            assertThat(BearerTokenExtractor.extract("bearer   my-token ")).contains("my-token");
            assertThat(BearerTokenExtractor.extract("BEARER\tmy-token")).contains("my-token");
        }
    }

    @Nested
    @DisplayName("invalid headers")
    class InvalidHeaders {

        @ParameterizedTest(name = "''{0}'' yields nothing")
        @NullAndEmptySource
        @ValueSource(strings = {"  ", "Bearer", "Bearer   ", "Basic dXNlcjpwYXNz", "Bearertoken"})
        void rejected(String header) {
            assertThat(BearerTokenExtractor.extract(header)).isEmpty();
        }
    }

    @Nested
    @DisplayName("cookie fallback")
    class CookieFallback {

        @Test
        @DisplayName("prefers the header")
        void headerWins() {
            assertThat(BearerTokenExtractor.extract("Bearer header-token", "cookie-token")).contains("header-token");
        }

        @Test
        @DisplayName("uses the cookie when the header is absent or malformed")
        void cookieUsed() {
            assertThat(BearerTokenExtractor.extract(null, "cookie-token")).contains("cookie-token");
            assertThat(BearerTokenExtractor.extract("Basic abc", "cookie-token")).contains("cookie-token");
        }

        @Test
        @DisplayName("yields nothing when neither carries a token")
        void neither() {
            assertThat(BearerTokenExtractor.extract(null, " ")).isEmpty();
        }
    }
}
