package tech.cids.platform.token.refresh;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for RefreshToken entities.
 */
public interface RefreshTokenRepository {

    // Read operations
    Optional<RefreshToken> findByTokenHash(String tokenHash);

    // Write operations
    void persist(RefreshToken token);

    /**
     * Revoke one token if it is still active.
     *
     * @return false when the token was already revoked or does not exist
     */
    boolean revokeToken(String tokenHash, String replacedBy);

    int revokeTokenFamily(String familyId);
    int revokeAllForSubject(String subject);
    long deleteExpired(Instant before);
}
