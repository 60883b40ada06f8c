package tech.cids.platform.discovery;

/**
 * A classified discovery failure.
 */
public class DiscoveryException extends Exception {

    private final DiscoveryErrorType errorType;

    public DiscoveryException(DiscoveryErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DiscoveryException(DiscoveryErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public DiscoveryErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }

    static DiscoveryException validation(String message) {
        return new DiscoveryException(DiscoveryErrorType.VALIDATION_ERROR, message);
    }
}
