package com.tessera.authservice.links;

import com.tessera.authservice.config.TesseraProperties;
import com.tessera.observability.SecurityMetrics;
import com.tessera.signedlink.SignedLinkException;
import com.tessera.signedlink.SignedLinkService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mints and verifies the signed links of the account recovery flows.
 * <p>
 * Links are signed against the API route of the flow and then re-homed onto the account UI,
 * which passes the query back unchanged for verification.
 */
@Service
public class RecoveryLinkService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryLinkService.class);

    private final SignedLinkService links;
    private final TesseraProperties.Links config;
    private final SecurityMetrics metrics;

    public RecoveryLinkService(SignedLinkService links, TesseraProperties properties, SecurityMetrics metrics) {
        this.links = links;
        this.config = properties.links();
        this.metrics = metrics;
    }

    /** Link for resetting the password of an existing user. */
    public String passwordResetLink(String userId, String tenantId) {
        return mint(LinkPurpose.PASSWORD_RESET, params("user_id", userId, "tenant_id", tenantId));
    }

    /** Link for registering through an invitation. */
    public String inviteLink(String inviteToken, String tenantId) {
        return mint(LinkPurpose.INVITE, params("invite_token", inviteToken, "tenant_id", tenantId));
    }

    /** Link confirming ownership of an email address. */
    public String emailVerificationLink(String userId, String email) {
        return mint(LinkPurpose.EMAIL_VERIFICATION, params("user_id", userId, "email", email));
    }

    /**
     * Verifies the query of an inbound link.
     *
     * @return the signed parameters, without the signature
     * @throws SignedLinkException when the link is incomplete, expired or tampered with
     */
    public Map<String, String> verify(String rawQuery) {
        try {
            return links.validateQuery(rawQuery);
        } catch (SignedLinkException e) {
            metrics.linkRejected(e.reason());
            log.info("Rejected signed link: {}", e.reason());
            throw e;
        }
    }

    /** The lifetime configured for a flow. */
    public Duration ttl(LinkPurpose purpose) {
        return switch (purpose) {
            case PASSWORD_RESET -> config.passwordResetTtl();
            case INVITE -> config.inviteTtl();
            case EMAIL_VERIFICATION -> config.emailVerificationTtl();
        };
    }

    private String mint(LinkPurpose purpose, Map<String, String> params) {
        Duration ttl = ttl(purpose);
        String apiUrl = links.generate(config.apiBaseUrl() + purpose.path(), params, ttl);
        log.debug("Minted {} link valid for {}", purpose, ttl);
        return SignedLinkService.toFrontendUrl(apiUrl, config.frontendBaseUrl() + purpose.path());
    }

    private static Map<String, String> params(String k1, String v1, String k2, String v2) {
        requireText(v1, k1);
        Map<String, String> params = new LinkedHashMap<>();
        params.put(k1, v1);
        if (v2 != null && !v2.isBlank()) {
            params.put(k2, v2);
        }
        return params;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
