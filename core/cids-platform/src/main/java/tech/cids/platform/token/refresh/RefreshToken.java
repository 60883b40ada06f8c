package tech.cids.platform.token.refresh;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A stored refresh token.
 *
 * <p>Only the SHA-256 hash of the token is kept. Tokens are rotated on every use: the presented
 * token is revoked and a new one is linked to it through {@link #parentTokenHash} in the same
 * family. Presenting a revoked token again revokes the whole family.
 *
 * <p>Access-token claims are recomposed from the identity fields on refresh.
 */
public class RefreshToken {

    public String tokenHash;

    public String subject;

    /**
     * All tokens rotated from one login share a family.
     */
    public String familyId;

    public String parentTokenHash;

    public String email;

    public String name;

    public List<String> groups = new ArrayList<>();

    /**
     * Application the access tokens of this family are issued for; null for all applications.
     */
    public String targetAppId;

    public String boundIp;

    public String boundDevice;

    public boolean revoked = false;

    public Instant revokedAt;

    /**
     * Hash of the token that replaced this one on rotation.
     */
    public String replacedBy;

    public Instant issuedAt;

    public Instant expiresAt;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isValid(Instant now) {
        return !revoked && !isExpired(now);
    }
}
