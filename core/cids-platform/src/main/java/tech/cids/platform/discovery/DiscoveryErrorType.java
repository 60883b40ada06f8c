package tech.cids.platform.discovery;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of discovery failures.
 *
 * <p>Determines retry behavior and the status string recorded on the application:
 * <ul>
 *   <li><b>AUTHENTICATION_ERROR</b>, <b>CONFIGURATION_ERROR</b> - terminal, never retried</li>
 *   <li>everything else - retried with backoff up to the configured limit</li>
 * </ul>
 */
public enum DiscoveryErrorType {
    NETWORK_ERROR("network_error", "connection_error", true),
    TIMEOUT_ERROR("timeout_error", "timeout", true),
    AUTHENTICATION_ERROR("authentication_error", "auth_error", false),
    VALIDATION_ERROR("validation_error", "validation_error", true),
    CONFIGURATION_ERROR("configuration_error", "error", false),
    SERVER_ERROR("server_error", "error", true),
    UNKNOWN_ERROR("unknown_error", "error", true);

    private final String value;
    private final String statusValue;
    private final boolean retryable;

    DiscoveryErrorType(String value, String statusValue, boolean retryable) {
        this.value = value;
        this.statusValue = statusValue;
        this.retryable = retryable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Discovery status written to the application record after a final failure of this type.
     */
    public String statusValue() {
        return statusValue;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Classify a non-2xx HTTP status.
     */
    public static DiscoveryErrorType fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTHENTICATION_ERROR;
        }
        if (status == 404) {
            return CONFIGURATION_ERROR;
        }
        if (status == 408) {
            return TIMEOUT_ERROR;
        }
        if (status == 429 || status >= 500) {
            return SERVER_ERROR;
        }
        return UNKNOWN_ERROR;
    }

    public static DiscoveryErrorType fromValue(String value) {
        for (DiscoveryErrorType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return UNKNOWN_ERROR;
    }
}
