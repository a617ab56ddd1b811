package com.tessera.security;

import java.util.List;

/**
 * One rule of a policy document. The statement fires for a request when any action pattern
 * matches the action and any resource pattern matches the resource.
 *
 * @param effect    allow or deny
 * @param actions   action patterns such as {@code user:*} or {@code role:create}
 * @param resources resource patterns such as {@code auth:*} or {@code account:profile}
 */
public record PolicyStatement(Effect effect, List<String> actions, List<String> resources) {

    public PolicyStatement {
        if (effect == null) {
            throw new IllegalArgumentException("effect must not be null");
        }
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("actions must not be empty");
        }
        if (resources == null || resources.isEmpty()) {
            throw new IllegalArgumentException("resources must not be empty");
        }
        actions = List.copyOf(actions);
        resources = List.copyOf(resources);
    }

    public static PolicyStatement allow(List<String> actions, List<String> resources) {
        return new PolicyStatement(Effect.ALLOW, actions, resources);
    }

    public static PolicyStatement deny(List<String> actions, List<String> resources) {
        return new PolicyStatement(Effect.DENY, actions, resources);
    }

    boolean fires(ResourcePattern action, ResourcePattern resource) {
        return actions.stream().anyMatch(pattern -> ResourcePattern.matches(pattern, action))
                && resources.stream().anyMatch(pattern -> ResourcePattern.matches(pattern, resource));
    }
}
