package tech.cids.platform.token.revocation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import tech.cids.platform.common.UnitOfWork;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Revocation list for access tokens.
 *
 * <p>Lookups hit a Caffeine cache in front of the revoked_tokens table. A revocation made on this
 * node is visible immediately; one made elsewhere becomes visible once the cached negative
 * answer expires.
 */
@ApplicationScoped
public class RevocationService {

    private static final Logger LOG = Logger.getLogger(RevocationService.class);

    @Inject
    RevokedTokenRepository revokedTokenRepository;

    @Inject
    UnitOfWork unitOfWork;

    @ConfigProperty(name = "cids.cache.revocation.ttl", defaultValue = "PT30S")
    Duration cacheTtl;

    @ConfigProperty(name = "cids.cache.revocation.max-size", defaultValue = "10000")
    long maxSize;

    /**
     * How long a row is kept after the revoked token itself expired.
     */
    @ConfigProperty(name = "cids.revocation.retention", defaultValue = "P7D")
    Duration retention;

    Clock clock = Clock.systemUTC();

    Ticker ticker = Ticker.systemTicker();

    private Cache<String, Boolean> cache;

    @PostConstruct
    void init() {
        cache = Caffeine.newBuilder()
            .expireAfterWrite(cacheTtl)
            .maximumSize(maxSize)
            .ticker(ticker)
            .build();
        LOG.infof("Revocation cache initialized: TTL=%s, maxSize=%d", cacheTtl, maxSize);
    }

    /**
     * Record the token as revoked. Revoking an already revoked token changes nothing.
     *
     * @param expiresAt expiry of the token being revoked
     */
    public void revoke(String jti, String subject, Instant expiresAt, RevocationReason reason) {
        boolean created = unitOfWork.inTransaction(() -> {
            if (revokedTokenRepository.existsByJti(jti)) {
                return false;
            }
            RevokedToken revoked = new RevokedToken();
            revoked.jti = jti;
            revoked.subject = subject;
            revoked.reason = reason;
            revoked.revokedAt = clock.instant();
            revoked.expiresAt = expiresAt;
            revokedTokenRepository.persist(revoked);
            return true;
        });
        cache.put(jti, Boolean.TRUE);
        if (created) {
            LOG.infof("Revoked access token %s of %s (%s)", jti, subject, reason);
        }
    }

    public boolean isRevoked(String jti) {
        return cache.get(jti, revokedTokenRepository::existsByJti);
    }

    public long cleanupExpired() {
        Instant cutoff = clock.instant().minus(retention);
        long deleted = unitOfWork.inTransaction(() -> revokedTokenRepository.deleteExpired(cutoff));
        if (deleted > 0) {
            LOG.infof("Deleted %d revocation record(s) expired before %s", deleted, cutoff);
        }
        return deleted;
    }
}
