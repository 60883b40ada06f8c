package tech.cids.platform.discovery.history.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.cids.platform.discovery.history.DiscoveryAttempt;
import tech.cids.platform.discovery.history.DiscoveryAttemptRepository;
import tech.cids.platform.discovery.history.entity.DiscoveryAttemptEntity;
import tech.cids.platform.discovery.history.mapper.DiscoveryAttemptMapper;

import java.util.List;

/**
 * Panache-based implementation of DiscoveryAttemptRepository.
 */
@ApplicationScoped
public class PanacheDiscoveryAttemptRepository
    implements DiscoveryAttemptRepository, PanacheRepositoryBase<DiscoveryAttemptEntity, String> {

    @Override
    public List<DiscoveryAttempt> findRecent(String appId, int limit) {
        return find("appId = ?1 order by timestamp desc, id desc", appId)
            .range(0, Math.max(limit, 1) - 1)
            .list()
            .stream()
            .map(DiscoveryAttemptMapper::toDomain)
            .toList();
    }

    @Override
    @Transactional
    public void append(DiscoveryAttempt attempt, int keep) {
        persist(DiscoveryAttemptMapper.toEntity(attempt));
        flush();
        List<String> stale = find("appId = ?1 order by timestamp desc, id desc", attempt.appId)
            .range(keep, Integer.MAX_VALUE - 1)
            .stream()
            .map(entity -> entity.id)
            .toList();
        if (!stale.isEmpty()) {
            delete("id in ?1", stale);
        }
    }

    @Override
    public long deleteByAppId(String appId) {
        return delete("appId", appId);
    }
}
