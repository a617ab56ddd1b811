package com.tessera.authservice.security;

import com.tessera.observability.SecurityMetrics;
import com.tessera.security.AuthorizationEngine;
import com.tessera.security.AuthorizationResult;
import com.tessera.security.Principal;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authenticates a request and authorizes one action on one resource.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final CredentialAuthenticator authenticator;
    private final AuthorizationEngine engine;
    private final SecurityMetrics metrics;

    public AccessGuard(CredentialAuthenticator authenticator, AuthorizationEngine engine, SecurityMetrics metrics) {
        this.authenticator = authenticator;
        this.engine = engine;
        this.metrics = metrics;
    }

    /**
     * @return the authorized principal
     * @throws UnauthenticatedException when the request has no valid credential
     * @throws AccessDeniedException    when the principal may not perform the action
     */
    public Principal require(HttpServletRequest request, String action, String resource) {
        return require(authenticator.authenticate(request), action, resource);
    }

    /**
     * Authorizes an already authenticated principal.
     *
     * @throws AccessDeniedException when the principal may not perform the action
     */
    public Principal require(Principal principal, String action, String resource) {
        AuthorizationResult result = engine.evaluate(principal, action, resource);
        metrics.authorizationDecided(result.decision());
        if (!result.allowed()) {
            log.info("Denied sub={} action={} resource={} basis={}", principal.subjectId(), action, resource,
                    result.basis());
            throw new AccessDeniedException(action, resource);
        }
        return principal;
    }
}
