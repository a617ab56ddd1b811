package com.tessera.authservice.web;

import com.tessera.authservice.security.AccessDeniedException;
import com.tessera.authservice.security.UnauthenticatedException;
import com.tessera.security.MalformedPolicyDocumentException;
import com.tessera.signedlink.SignedLinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 * <p>
 * Credential and link failures are answered with fixed messages whatever the underlying
 * reason; only policy document errors are reported in full.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String LINK_FAILURE_DETAIL = "Invalid or expired link";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_TYPE_BASE = "https://tessera.dev/errors/";

    @ExceptionHandler(UnauthenticatedException.class)
    public ProblemDetail handleUnauthenticated(UnauthenticatedException ex) {
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthenticated", UnauthenticatedException.MESSAGE);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.warn("Forbidden: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden",
                "Not allowed to perform " + ex.action() + " on " + ex.resource());
    }

    @ExceptionHandler(SignedLinkException.class)
    public ProblemDetail handleSignedLink(SignedLinkException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "invalid-link", LINK_FAILURE_DETAIL);
    }

    @ExceptionHandler(MalformedPolicyDocumentException.class)
    public ProblemDetail handleMalformedPolicy(MalformedPolicyDocumentException ex) {
        log.debug("Rejected policy document: {}", ex.errors());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid Policy Document", "policy-document",
                "Policy document is invalid");
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is missing or unreadable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // routing and content negotiation failures keep their own 4xx status
            ProblemDetail body = framework.getBody();
            body.setProperty("timestamp", Instant.now().toString());
            return body;
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
        return problem;
    }
}
