package tech.cids.platform.common;

import tech.cids.platform.common.errors.UseCaseError;

import java.util.function.Function;

/**
 * Result type for administrative write operations.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Role, policy and template writes validate everything up front and return a
 * {@link Failure} without committing anything when validation fails:
 * <pre>{@code
 * if (roleName.isBlank()) {
 *     return Result.failure(UseCaseError.validation("ROLE_NAME_REQUIRED", "Role name is required"));
 * }
 * return Result.success(outcome);
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }

    /**
     * Transform the success value, passing failures through untouched.
     */
    default <R> Result<R> map(Function<T, R> mapper) {
        if (this instanceof Success<T> s) {
            return Result.success(mapper.apply(s.value()));
        }
        return Result.failure(((Failure<T>) this).error());
    }

    /**
     * The success value, or {@code null} for a failure.
     */
    default T valueOrNull() {
        return this instanceof Success<T> s ? s.value() : null;
    }

    /**
     * The error, or {@code null} for a success.
     */
    default UseCaseError errorOrNull() {
        return this instanceof Failure<T> f ? f.error() : null;
    }
}
