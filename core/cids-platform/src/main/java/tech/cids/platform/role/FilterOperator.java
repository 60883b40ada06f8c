package tech.cids.platform.role;

/**
 * How a row filter clause combines with the clauses before it.
 */
public enum FilterOperator {
    AND,
    OR
}
