package tech.cids.platform.token.revocation;

import java.time.Instant;

/**
 * An access token revoked before its expiry, keyed by its {@code jti}.
 *
 * <p>Rows are kept past the token's expiry for a retention period, then purged.
 */
public class RevokedToken {

    public String jti;

    public String subject;

    public RevocationReason reason;

    public Instant revokedAt;

    /**
     * Expiry of the revoked token itself.
     */
    public Instant expiresAt;
}
