package tech.cids.platform.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for use case failures.
 *
 * Errors are categorized by type so callers can map them to a response
 * status without inspecting messages.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Input validation failed (malformed permission key, duplicate role, missing field).
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Business rule violation (entity in wrong state, constraint violated).
     */
    record BusinessRuleViolation(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Entity not found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * A concurrent writer holds the per-application lock.
     */
    record ConcurrencyError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Caller not authorized to perform this action.
     */
    record AuthorizationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    static ValidationError validation(String code, String message) {
        return new ValidationError(code, message, Map.of());
    }

    static ValidationError validation(String code, String message, Map<String, Object> details) {
        return new ValidationError(code, message, details);
    }

    static NotFoundError notFound(String code, String message, Map<String, Object> details) {
        return new NotFoundError(code, message, details);
    }

    static BusinessRuleViolation businessRule(String code, String message) {
        return new BusinessRuleViolation(code, message, Map.of());
    }

    static ConcurrencyError concurrency(String code, String message, Map<String, Object> details) {
        return new ConcurrencyError(code, message, details);
    }
}
