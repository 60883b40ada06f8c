package tech.cids.platform.token.refresh.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.token.refresh.RefreshToken;
import tech.cids.platform.token.refresh.RefreshTokenRepository;
import tech.cids.platform.token.refresh.entity.RefreshTokenEntity;
import tech.cids.platform.token.refresh.mapper.RefreshTokenMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of RefreshTokenRepository.
 */
@ApplicationScoped
public class PanacheRefreshTokenRepository
    implements RefreshTokenRepository, PanacheRepositoryBase<RefreshTokenEntity, String> {

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    public void persist(RefreshToken token) {
        persist(RefreshTokenMapper.toEntity(token));
    }

    @Override
    public boolean revokeToken(String tokenHash, String replacedBy) {
        return update("revoked = true, revokedAt = ?1, replacedBy = ?2 where tokenHash = ?3 and revoked = false",
            Instant.now(), replacedBy, tokenHash) > 0;
    }

    @Override
    public int revokeTokenFamily(String familyId) {
        return update("revoked = true, revokedAt = ?1 where familyId = ?2 and revoked = false",
            Instant.now(), familyId);
    }

    @Override
    public int revokeAllForSubject(String subject) {
        return update("revoked = true, revokedAt = ?1 where subject = ?2 and revoked = false",
            Instant.now(), subject);
    }

    @Override
    public long deleteExpired(Instant before) {
        return delete("expiresAt < ?1", before);
    }
}
