package com.tessera.authservice.config;

import com.tessera.authservice.security.PrincipalDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Fallback {@link PrincipalDirectory} that grants nothing to anyone. Backs off as soon as the
 * application defines its own directory, typically one backed by the user and role store.
 * <p>
 * Must stay an auto-configuration: the condition has to see application and test beans.
 */
@AutoConfiguration
public class PrincipalDirectoryAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PrincipalDirectoryAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(PrincipalDirectory.class)
    public PrincipalDirectory principalDirectory() {
        log.warn("No principal directory configured: authenticated callers receive no permissions");
        return (subjectId, tenantId) -> PrincipalDirectory.Grants.none();
    }
}
