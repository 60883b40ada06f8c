package tech.cids.platform.token;

/**
 * A presented access or refresh token was not accepted.
 */
public class TokenValidationException extends RuntimeException {

    public enum Reason {
        /** Bad signature, wrong issuer or unparseable. */
        INVALID,
        EXPIRED,
        REVOKED,
        /** Presented from a different client IP or device than it was bound to. */
        BINDING_MISMATCH,
        /** A rotated-away refresh token was presented again. */
        REPLAY_DETECTED,
        UNKNOWN_TOKEN
    }

    private final Reason reason;

    public TokenValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
