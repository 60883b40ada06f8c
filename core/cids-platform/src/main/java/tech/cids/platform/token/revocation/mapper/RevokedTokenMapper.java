package tech.cids.platform.token.revocation.mapper;

import tech.cids.platform.token.revocation.RevokedToken;
import tech.cids.platform.token.revocation.entity.RevokedTokenEntity;

/**
 * Mapper for converting between RevokedToken domain model and JPA entity.
 */
public final class RevokedTokenMapper {

    private RevokedTokenMapper() {
    }

    public static RevokedToken toDomain(RevokedTokenEntity entity) {
        if (entity == null) {
            return null;
        }
        RevokedToken domain = new RevokedToken();
        domain.jti = entity.jti;
        domain.subject = entity.subject;
        domain.reason = entity.reason;
        domain.revokedAt = entity.revokedAt;
        domain.expiresAt = entity.expiresAt;
        return domain;
    }

    public static RevokedTokenEntity toEntity(RevokedToken domain) {
        if (domain == null) {
            return null;
        }
        RevokedTokenEntity entity = new RevokedTokenEntity();
        entity.jti = domain.jti;
        entity.subject = domain.subject;
        entity.reason = domain.reason;
        entity.revokedAt = domain.revokedAt;
        entity.expiresAt = domain.expiresAt;
        return entity;
    }
}
