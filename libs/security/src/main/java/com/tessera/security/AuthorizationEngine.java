package com.tessera.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Combines flat permissions and policy documents into one decision.
 * <p>
 * A request is allowed when a permission for an action of the resource's family or a policy allow
 * statement matches, and no policy deny statement fires. The engine is total: a missing principal
 * or a blank or unparsable action or resource is denied, never thrown.
 */
public final class AuthorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    /**
     * Decides whether {@code principal} may perform {@code action} on {@code resource}.
     *
     * @param action   {@code family:verb} or a bare verb qualified by the resource family
     * @param resource {@code family:name} or a bare {@code family}
     */
    public Decision authorize(Principal principal, String action, String resource) {
        return evaluate(principal, action, resource).decision();
    }

    /** Like {@link #authorize} but also reports the basis of the decision. */
    public AuthorizationResult evaluate(Principal principal, String action, String resource) {
        if (principal == null) {
            return AuthorizationResult.deny(AuthorizationResult.Basis.INVALID_REQUEST);
        }
        Optional<ResourcePattern> requestedResource = ResourcePattern.parseResource(resource);
        Optional<ResourcePattern> requestedAction = requestedResource
                .flatMap(r -> ResourcePattern.qualifyAction(action, r));
        if (requestedResource.isEmpty() || requestedAction.isEmpty()) {
            log.debug("Denied sub={}: unusable request action='{}' resource='{}'",
                    principal.subjectId(), action, resource);
            return AuthorizationResult.deny(AuthorizationResult.Basis.INVALID_REQUEST);
        }

        AuthorizationResult result = decide(principal, requestedAction.get(), requestedResource.get());
        log.debug("{} sub={} action={} resource={} basis={}", result.decision(), principal.subjectId(),
                requestedAction.get(), requestedResource.get(), result.basis());
        return result;
    }

    private static AuthorizationResult decide(Principal principal, ResourcePattern action, ResourcePattern resource) {
        PolicyOutcome policy = PolicyEvaluator.evaluate(principal.policies(), action, resource);
        if (policy == PolicyOutcome.DENY) {
            return AuthorizationResult.deny(AuthorizationResult.Basis.EXPLICIT_DENY);
        }
        if (PermissionChecker.allows(principal.permissions(), action, resource)) {
            return AuthorizationResult.allow(AuthorizationResult.Basis.PERMISSION);
        }
        if (policy == PolicyOutcome.ALLOW) {
            return AuthorizationResult.allow(AuthorizationResult.Basis.POLICY_ALLOW);
        }
        return AuthorizationResult.deny(AuthorizationResult.Basis.NO_MATCH);
    }
}
