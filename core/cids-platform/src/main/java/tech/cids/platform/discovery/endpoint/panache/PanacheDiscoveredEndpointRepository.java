package tech.cids.platform.discovery.endpoint.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.cids.platform.discovery.endpoint.DiscoveredEndpoint;
import tech.cids.platform.discovery.endpoint.DiscoveredEndpointRepository;
import tech.cids.platform.discovery.endpoint.entity.DiscoveredEndpointEntity;
import tech.cids.platform.discovery.endpoint.mapper.DiscoveredEndpointMapper;

import java.util.List;

/**
 * Panache-based implementation of DiscoveredEndpointRepository.
 */
@ApplicationScoped
public class PanacheDiscoveredEndpointRepository
    implements DiscoveredEndpointRepository, PanacheRepositoryBase<DiscoveredEndpointEntity, String> {

    @Override
    public List<DiscoveredEndpoint> findByAppId(String appId) {
        return find("appId = ?1 order by path, method", appId)
            .list()
            .stream()
            .map(DiscoveredEndpointMapper::toDomain)
            .toList();
    }

    @Override
    @Transactional
    public void replaceForApp(String appId, List<DiscoveredEndpoint> endpoints) {
        delete("appId", appId);
        persist(endpoints.stream().map(DiscoveredEndpointMapper::toEntity));
    }

    @Override
    public long deleteByAppId(String appId) {
        return delete("appId", appId);
    }
}
