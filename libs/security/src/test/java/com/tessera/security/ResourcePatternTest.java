package com.tessera.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResourcePattern")
class ResourcePatternTest {

    private static ResourcePattern p(String value) {
        return ResourcePattern.parse(value).orElseThrow();
    }

    @Test
    @DisplayName("parses family and name")
    void parses() {
        assertThat(p("user:create")).isEqualTo(new ResourcePattern("user", "create"));
        assertThat(p(" role : * ")).isEqualTo(new ResourcePattern("role", "*"));
        assertThat(p("svc:api:v2").name()).isEqualTo("api:v2");
    }

    @ParameterizedTest(name = "''{0}'' is not a pattern")
    @ValueSource(strings = {"", "user", ":create", "user:", " : ", "user:  "})
    void rejectsMalformed(String value) {
        assertThat(ResourcePattern.parse(value)).isEmpty();
    }

    @Test
    @DisplayName("matches equal names and wildcards within one family")
    void matching() {
        assertThat(p("user:create").matches(p("user:create"))).isTrue();
        assertThat(p("user:*").matches(p("user:create"))).isTrue();
        assertThat(p("user:create").matches(p("user:delete"))).isFalse();
        assertThat(p("user:*").matches(p("role:create"))).isFalse();
        assertThat(p("*:*").matches(p("user:create"))).isFalse();
    }

    @Test
    @DisplayName("a bare family only matches wildcard patterns")
    void bareFamily() {
        ResourcePattern auth = ResourcePattern.parseResource("auth").orElseThrow();

        assertThat(auth.name()).isNull();
        assertThat(auth.toString()).isEqualTo("auth");
        assertThat(p("auth:*").matches(auth)).isTrue();
        assertThat(p("auth:login").matches(auth)).isFalse();
    }

    @Test
    @DisplayName("qualifies bare verbs with the resource family")
    void qualifiesActions() {
        ResourcePattern doc = ResourcePattern.parseResource("doc:readme").orElseThrow();

        assertThat(ResourcePattern.qualifyAction("read", doc)).contains(new ResourcePattern("doc", "read"));
        assertThat(ResourcePattern.qualifyAction("user:create", doc)).contains(new ResourcePattern("user", "create"));
        assertThat(ResourcePattern.qualifyAction(" ", doc)).isEmpty();
    }
}
