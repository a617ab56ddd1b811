package com.tessera.authservice;

import com.tessera.authservice.config.TesseraProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Tessera auth service: wires secret resolution, the key ring, token issuance and validation,
 * signed recovery links and the authorization engine into one Spring Boot process.
 * <p>
 * Key material is loaded while the context starts; a missing or invalid key aborts startup.
 */
@SpringBootApplication
@EnableConfigurationProperties(TesseraProperties.class)
public class AuthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
        log.info("Tessera auth service started");
    }
}
