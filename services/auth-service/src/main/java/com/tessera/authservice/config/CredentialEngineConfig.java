package com.tessera.authservice.config;

import com.tessera.observability.MetricFactory;
import com.tessera.observability.SecurityMetrics;
import com.tessera.observability.SensitiveDataRedactor;
import com.tessera.secrets.SecretResolver;
import com.tessera.security.AuthorizationEngine;
import com.tessera.signedlink.LinkSigningKey;
import com.tessera.signedlink.SignedLinkService;
import com.tessera.token.KeyRing;
import com.tessera.token.TokenService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the credential engine from {@link TesseraProperties}.
 * <p>
 * The key ring and link key are created empty here and filled by
 * {@link com.tessera.authservice.keys.KeyMaterialLoader} during startup.
 */
@Configuration
public class CredentialEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(CredentialEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecretResolver secretResolver(TesseraProperties properties) {
        SecretResolver resolver = SecretResolver.fromConfig(properties.secrets().toConfig());
        log.info("Secret resolution uses the {} backend", resolver.backend().selector());
        return resolver;
    }

    @Bean
    public KeyRing keyRing() {
        return new KeyRing();
    }

    @Bean
    public LinkSigningKey linkSigningKey() {
        return new LinkSigningKey();
    }

    @Bean
    public TokenService tokenService(KeyRing keyRing, TesseraProperties properties, Clock clock) {
        TesseraProperties.Tokens tokens = properties.tokens();
        return new TokenService(keyRing, tokens.toTtls(), tokens.clockSkew(), clock);
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public SignedLinkService signedLinkService(LinkSigningKey linkSigningKey, Clock clock,
                                               SensitiveDataRedactor redactor) {
        return new SignedLinkService(linkSigningKey, clock, redactor);
    }

    @Bean
    public AuthorizationEngine authorizationEngine() {
        return new AuthorizationEngine();
    }

    @Bean
    public SecurityMetrics securityMetrics(MeterRegistry registry, TesseraProperties properties) {
        return new SecurityMetrics(new MetricFactory(registry, properties.serviceName()));
    }
}
