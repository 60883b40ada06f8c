package tech.cids.platform.support;

import tech.cids.platform.discovery.endpoint.DiscoveredEndpoint;
import tech.cids.platform.discovery.endpoint.DiscoveredEndpointRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDiscoveredEndpointRepository implements DiscoveredEndpointRepository {

    private final Map<String, List<DiscoveredEndpoint>> endpoints = new ConcurrentHashMap<>();

    @Override
    public List<DiscoveredEndpoint> findByAppId(String appId) {
        return new ArrayList<>(endpoints.getOrDefault(appId, List.of()));
    }

    @Override
    public void replaceForApp(String appId, List<DiscoveredEndpoint> replacement) {
        endpoints.put(appId, new ArrayList<>(replacement));
    }

    @Override
    public long deleteByAppId(String appId) {
        List<DiscoveredEndpoint> removed = endpoints.remove(appId);
        return removed != null ? removed.size() : 0;
    }
}
