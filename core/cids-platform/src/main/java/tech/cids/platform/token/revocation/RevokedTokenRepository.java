package tech.cids.platform.token.revocation;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for RevokedToken entities.
 */
public interface RevokedTokenRepository {

    // Read operations
    boolean existsByJti(String jti);
    Optional<RevokedToken> findByJti(String jti);

    // Write operations
    void persist(RevokedToken token);
    long deleteExpired(Instant before);
}
