package tech.cids.platform.policy.abac;

import java.util.Set;

/**
 * Result of evaluating one ABAC rule.
 */
public sealed interface AbacOutcome {

    /**
     * The rule was evaluated; {@code grantedPermissions} is empty when its condition did not hold.
     */
    record Evaluated(String ruleName, Set<String> grantedPermissions) implements AbacOutcome {
        public Evaluated {
            grantedPermissions = grantedPermissions != null ? Set.copyOf(grantedPermissions) : Set.of();
        }
    }

    /**
     * No evaluator understands the rule. It contributes nothing.
     */
    record NotImplemented(String ruleName, String reason) implements AbacOutcome {
    }

    static AbacOutcome notImplemented(String ruleName, String reason) {
        return new NotImplemented(ruleName, reason);
    }
}
