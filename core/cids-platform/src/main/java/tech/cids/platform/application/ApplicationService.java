package tech.cids.platform.application;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.common.Result;
import tech.cids.platform.common.UnitOfWork;
import tech.cids.platform.common.errors.UseCaseError;
import tech.cids.platform.discovery.DiscoveryService;
import tech.cids.platform.discovery.endpoint.DiscoveredEndpointRepository;
import tech.cids.platform.discovery.history.DiscoveryAttemptRepository;
import tech.cids.platform.permission.PermissionRegistry;
import tech.cids.platform.policy.GroupRoleMappingRepository;
import tech.cids.platform.shared.EntityType;
import tech.cids.platform.shared.TsidGenerator;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registers applications and removes them with everything derived from them.
 */
@ApplicationScoped
public class ApplicationService {

    private static final Logger LOG = Logger.getLogger(ApplicationService.class);

    /**
     * App ids prefix permission keys, so they cannot contain the key separators.
     */
    private static final Pattern APP_ID = Pattern.compile("[a-z0-9][a-z0-9_-]{0,63}");

    @Inject
    RegisteredApplicationRepository applicationRepository;

    @Inject
    PermissionRegistry permissionRegistry;

    @Inject
    GroupRoleMappingRepository mappingRepository;

    @Inject
    DiscoveredEndpointRepository endpointRepository;

    @Inject
    DiscoveryAttemptRepository attemptRepository;

    @Inject
    DiscoveryService discoveryService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<RegisteredApplication> registerApplication(String appId, String name, String description,
                                                             String discoveryUrl, boolean allowDiscovery) {
        if (appId == null || !APP_ID.matcher(appId).matches()) {
            return Result.failure(UseCaseError.validation("INVALID_APP_ID",
                "App id must be lowercase letters, digits, '_' or '-'", Map.of("appId", String.valueOf(appId))));
        }
        if (name == null || name.isBlank()) {
            return Result.failure(UseCaseError.validation("NAME_REQUIRED", "Application name is required"));
        }
        Optional<UseCaseError> urlError = checkDiscoveryUrl(discoveryUrl);
        if (urlError.isPresent()) {
            return Result.failure(urlError.get());
        }

        RegisteredApplication application = new RegisteredApplication(
            TsidGenerator.generate(EntityType.APPLICATION), appId, name, blankToNull(discoveryUrl), allowDiscovery);
        application.description = description;

        boolean created = unitOfWork.inTransaction(() -> {
            if (applicationRepository.existsByAppId(appId)) {
                return false;
            }
            applicationRepository.persist(application);
            return true;
        });
        if (!created) {
            return Result.failure(UseCaseError.businessRule("APPLICATION_EXISTS",
                "Application already registered: " + appId));
        }
        LOG.infof("Registered application %s (discovery %s)", appId, allowDiscovery ? "enabled" : "disabled");
        return Result.success(application);
    }

    /**
     * Change where and whether the application is discovered. The cached discovery result is
     * dropped so the next run uses the new settings.
     */
    public Result<RegisteredApplication> updateDiscoverySettings(String appId, String discoveryUrl,
                                                                 boolean allowDiscovery) {
        Optional<UseCaseError> urlError = checkDiscoveryUrl(discoveryUrl);
        if (urlError.isPresent()) {
            return Result.failure(urlError.get());
        }
        Optional<RegisteredApplication> updated = unitOfWork.inTransaction(() -> {
            Optional<RegisteredApplication> found = applicationRepository.findByAppId(appId);
            found.ifPresent(application -> {
                application.discoveryUrl = blankToNull(discoveryUrl);
                application.allowDiscovery = allowDiscovery;
                applicationRepository.update(application);
            });
            return found;
        });
        if (updated.isEmpty()) {
            return notFound(appId);
        }
        discoveryService.invalidateCache(appId);
        LOG.infof("Updated discovery settings of application %s", appId);
        return Result.success(updated.get());
    }

    /**
     * Delete the application with its roles, permission catalog, group mappings, endpoints and
     * discovery history, in one transaction.
     */
    public Result<Void> deleteApplication(String appId) {
        boolean deleted = unitOfWork.inTransaction(() -> {
            if (!applicationRepository.existsByAppId(appId)) {
                return false;
            }
            permissionRegistry.deleteApplicationData(appId);
            long mappings = mappingRepository.deleteByAppId(appId);
            long endpoints = endpointRepository.deleteByAppId(appId);
            long attempts = attemptRepository.deleteByAppId(appId);
            applicationRepository.deleteByAppId(appId);
            LOG.debugf("Deleted %d group mappings, %d endpoints and %d discovery attempts of app %s",
                mappings, endpoints, attempts, appId);
            return true;
        });
        if (!deleted) {
            return notFound(appId);
        }

        permissionRegistry.evictApplication(appId);
        discoveryService.evictApplication(appId);
        LOG.infof("Deleted application %s", appId);
        return Result.success(null);
    }

    public Optional<RegisteredApplication> getApplication(String appId) {
        return applicationRepository.findByAppId(appId);
    }

    public List<RegisteredApplication> listApplications() {
        return applicationRepository.listApplications();
    }

    private static <T> Result<T> notFound(String appId) {
        return Result.failure(UseCaseError.notFound("APPLICATION_NOT_FOUND",
            "Application not registered: " + appId, Map.of("appId", String.valueOf(appId))));
    }

    private static Optional<UseCaseError> checkDiscoveryUrl(String discoveryUrl) {
        if (discoveryUrl == null || discoveryUrl.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(discoveryUrl);
            String scheme = uri.getScheme();
            if (("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) && uri.getHost() != null) {
                return Optional.empty();
            }
        } catch (URISyntaxException e) {
            LOG.debugf("Unparseable discovery URL %s: %s", discoveryUrl, e.getMessage());
        }
        return Optional.of(UseCaseError.validation("INVALID_DISCOVERY_URL",
            "Discovery URL must be an absolute http(s) URL", Map.of("discoveryUrl", discoveryUrl)));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
