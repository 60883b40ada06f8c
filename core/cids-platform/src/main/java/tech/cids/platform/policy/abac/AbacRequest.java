package tech.cids.platform.policy.abac;

import java.util.Map;
import java.util.Set;

/**
 * The subject attributes an ABAC rule is evaluated against.
 */
public record AbacRequest(
    String subject,
    Set<String> groups,
    Map<String, Object> attributes
) {
    public AbacRequest {
        groups = groups != null ? Set.copyOf(groups) : Set.of();
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }
}
