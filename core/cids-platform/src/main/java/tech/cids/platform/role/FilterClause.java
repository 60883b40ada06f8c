package tech.cids.platform.role;

/**
 * One row-level security predicate. The expression is opaque to this service and is
 * evaluated by the downstream application.
 */
public record FilterClause(String filterExpression, FilterOperator operator, int priority) {

    public FilterClause {
        if (filterExpression == null || filterExpression.isBlank()) {
            throw new IllegalArgumentException("Filter expression must not be blank");
        }
        operator = operator != null ? operator : FilterOperator.AND;
    }

    public static FilterClause and(String filterExpression) {
        return new FilterClause(filterExpression, FilterOperator.AND, 0);
    }
}
