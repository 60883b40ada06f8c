package tech.cids.platform.policy.abac;

/**
 * Evaluates attribute-based rules. Provide an alternative bean to replace the default,
 * which evaluates nothing.
 */
public interface AbacEvaluator {

    AbacOutcome evaluate(AbacRule rule, AbacRequest request);
}
