package tech.cids.platform.token.revocation.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.token.revocation.RevokedToken;
import tech.cids.platform.token.revocation.RevokedTokenRepository;
import tech.cids.platform.token.revocation.entity.RevokedTokenEntity;
import tech.cids.platform.token.revocation.mapper.RevokedTokenMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of RevokedTokenRepository.
 */
@ApplicationScoped
public class PanacheRevokedTokenRepository
    implements RevokedTokenRepository, PanacheRepositoryBase<RevokedTokenEntity, String> {

    @Override
    public boolean existsByJti(String jti) {
        return count("jti", jti) > 0;
    }

    @Override
    public Optional<RevokedToken> findByJti(String jti) {
        return findByIdOptional(jti).map(RevokedTokenMapper::toDomain);
    }

    @Override
    public void persist(RevokedToken token) {
        persist(RevokedTokenMapper.toEntity(token));
    }

    @Override
    public long deleteExpired(Instant before) {
        return delete("expiresAt < ?1", before);
    }
}
