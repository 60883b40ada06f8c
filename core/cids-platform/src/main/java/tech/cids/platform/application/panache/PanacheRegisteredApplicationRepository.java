package tech.cids.platform.application.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.application.RegisteredApplication;
import tech.cids.platform.application.RegisteredApplicationRepository;
import tech.cids.platform.application.entity.RegisteredApplicationEntity;
import tech.cids.platform.application.mapper.RegisteredApplicationMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of RegisteredApplicationRepository.
 */
@ApplicationScoped
public class PanacheRegisteredApplicationRepository
    implements RegisteredApplicationRepository, PanacheRepositoryBase<RegisteredApplicationEntity, String> {

    @Override
    public Optional<RegisteredApplication> findByAppId(String appId) {
        return find("appId", appId)
            .firstResultOptional()
            .map(RegisteredApplicationMapper::toDomain);
    }

    @Override
    public List<RegisteredApplication> listApplications() {
        return findAll().list().stream()
            .map(RegisteredApplicationMapper::toDomain)
            .toList();
    }

    @Override
    public List<RegisteredApplication> findDiscoverable() {
        return find("allowDiscovery = true and active = true and discoveryUrl is not null")
            .list()
            .stream()
            .map(RegisteredApplicationMapper::toDomain)
            .toList();
    }

    @Override
    public boolean existsByAppId(String appId) {
        return count("appId", appId) > 0;
    }

    @Override
    public void persist(RegisteredApplication application) {
        if (application.createdAt == null) {
            application.createdAt = Instant.now();
        }
        application.updatedAt = Instant.now();
        persist(RegisteredApplicationMapper.toEntity(application));
    }

    @Override
    public void update(RegisteredApplication application) {
        application.updatedAt = Instant.now();
        RegisteredApplicationEntity entity = findById(application.id);
        if (entity != null) {
            RegisteredApplicationMapper.updateEntity(entity, application);
        }
    }

    @Override
    public boolean deleteByAppId(String appId) {
        return delete("appId", appId) > 0;
    }
}
