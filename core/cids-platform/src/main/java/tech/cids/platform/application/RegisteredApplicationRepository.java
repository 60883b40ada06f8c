package tech.cids.platform.application;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for RegisteredApplication entities.
 */
public interface RegisteredApplicationRepository {

    // Read operations
    Optional<RegisteredApplication> findByAppId(String appId);
    List<RegisteredApplication> listApplications();
    List<RegisteredApplication> findDiscoverable();
    boolean existsByAppId(String appId);

    // Write operations
    void persist(RegisteredApplication application);
    void update(RegisteredApplication application);
    boolean deleteByAppId(String appId);
}
