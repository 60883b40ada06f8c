package tech.cids.platform.policy.abac;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Default evaluator. ABAC conditions have no expression language yet, so every rule
 * comes back as {@link AbacOutcome.NotImplemented}.
 */
@DefaultBean
@ApplicationScoped
public class NotImplementedAbacEvaluator implements AbacEvaluator {

    @Override
    public AbacOutcome evaluate(AbacRule rule, AbacRequest request) {
        return AbacOutcome.notImplemented(rule.name(), "ABAC condition evaluation is not implemented");
    }
}
