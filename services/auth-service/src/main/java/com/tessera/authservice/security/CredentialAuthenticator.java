package com.tessera.authservice.security;

import com.tessera.observability.SecurityMetrics;
import com.tessera.security.BearerTokenExtractor;
import com.tessera.security.Principal;
import com.tessera.token.TokenClaims;
import com.tessera.token.TokenService;
import com.tessera.token.TokenType;
import com.tessera.token.TokenValidationException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

/**
 * Turns the bearer credential of a request into a {@link Principal}: extract, validate as an
 * access token, then look up the subject's grants in the {@link PrincipalDirectory}.
 */
@Component
public class CredentialAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(CredentialAuthenticator.class);

    private final TokenService tokens;
    private final PrincipalDirectory directory;
    private final SecurityMetrics metrics;

    public CredentialAuthenticator(TokenService tokens, PrincipalDirectory directory, SecurityMetrics metrics) {
        this.tokens = tokens;
        this.directory = directory;
        this.metrics = metrics;
    }

    /**
     * @throws UnauthenticatedException when the request has no valid access token
     */
    public Principal authenticate(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, BearerTokenExtractor.ACCESS_TOKEN_COOKIE);
        return authenticate(request.getHeader(HttpHeaders.AUTHORIZATION), cookie == null ? null : cookie.getValue());
    }

    /**
     * @param authorizationHeader raw Authorization header, may be null
     * @param accessTokenCookie   value of the access token cookie, may be null
     * @throws UnauthenticatedException when neither carries a valid access token
     */
    public Principal authenticate(String authorizationHeader, String accessTokenCookie) {
        String token = BearerTokenExtractor.extract(authorizationHeader, accessTokenCookie)
                .orElseThrow(() -> {
                    log.debug("Request carries no bearer credential");
                    return new UnauthenticatedException();
                });
        TokenClaims claims;
        try {
            claims = tokens.validate(token, TokenType.ACCESS);
        } catch (TokenValidationException e) {
            metrics.tokenRejected(e.reason());
            log.info("Rejected access token: {}", e.reason());
            throw new UnauthenticatedException();
        }
        String tenantId = claims.tenantId().orElse(null);
        PrincipalDirectory.Grants grants = directory.grantsFor(claims.subject(), tenantId);
        return new Principal(claims.subject(), tenantId, grants.permissions(), grants.policies());
    }
}
