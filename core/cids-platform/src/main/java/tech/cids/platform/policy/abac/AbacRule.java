package tech.cids.platform.policy.abac;

import java.util.List;

/**
 * An attribute-based rule: when {@code condition} holds, {@code permissions} are granted.
 * The condition is an opaque expression string.
 */
public record AbacRule(
    String name,
    String description,
    String condition,
    List<String> permissions
) {
    public AbacRule {
        permissions = permissions != null ? List.copyOf(permissions) : List.of();
    }
}
