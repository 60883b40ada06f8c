package tech.cids.platform.permission;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import tech.cids.platform.application.RegisteredApplicationRepository;
import tech.cids.platform.common.Result;
import tech.cids.platform.common.UnitOfWork;
import tech.cids.platform.common.errors.UseCaseError;
import tech.cids.platform.lock.DistributedLock;
import tech.cids.platform.role.FilterClause;
import tech.cids.platform.role.RlsFilters;
import tech.cids.platform.role.Role;
import tech.cids.platform.role.RoleRepository;
import tech.cids.platform.shared.EntityType;
import tech.cids.platform.shared.TsidGenerator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-application permission catalog and role definitions.
 *
 * <p>The registry is the only writer of catalogs and roles. Writes for one application run
 * under that application's lock: the store is written in one transaction, then the
 * in-memory view is refreshed. Reads are served from the in-memory view and fall through
 * to the store on a miss, so a restart loses nothing.
 *
 * <p>Permission matching is wildcard-aware. A key is granted when it, or any ancestor
 * wildcard of it ({@code a.b.c.*}, {@code a.b.*}, {@code a.*}, {@code *}), is allowed by
 * one of the caller's roles and not denied by any of them under the same matching.
 */
@ApplicationScoped
public class PermissionRegistry {

    private static final Logger LOG = Logger.getLogger(PermissionRegistry.class);
    private static final String LOCK_PREFIX = "permission-registry:";
    private static final int SUGGESTED_PERMISSION_LIMIT = 10;
    private static final Set<String> EDITOR_ACTIONS = Set.of(PermissionExpander.ACTION_READ,
        PermissionExpander.ACTION_WRITE, "create", "update");

    @Inject
    PermissionCatalogRepository catalogRepository;

    @Inject
    RoleRepository roleRepository;

    @Inject
    RegisteredApplicationRepository applicationRepository;

    @Inject
    DistributedLock lock;

    @Inject
    UnitOfWork unitOfWork;

    @ConfigProperty(name = "cids.registry.lock-timeout", defaultValue = "PT10S")
    Duration lockTimeout;

    // appId -> (permission key -> metadata), sorted by key
    private final Map<String, SortedMap<String, PermissionMetadata>> catalogs = new ConcurrentHashMap<>();

    // appId -> (role name -> role)
    private final Map<String, Map<String, Role>> roles = new ConcurrentHashMap<>();

    // ========================================================================
    // Catalog
    // ========================================================================

    /**
     * Replace the application's permission catalog. Roles are left untouched.
     *
     * @return the number of permissions now registered
     * @throws IllegalStateException if the application's lock cannot be acquired in time
     */
    public int registerPermissions(String appId, Collection<PermissionMetadata> permissions) {
        SortedMap<String, PermissionMetadata> catalog = new TreeMap<>();
        for (PermissionMetadata permission : permissions) {
            catalog.put(permission.permissionKey(), permission);
        }

        Optional<Integer> registered = lock.withLock(LOCK_PREFIX + appId, lockTimeout, () -> {
            unitOfWork.inTransaction(() -> catalogRepository.replaceCatalog(appId, catalog.values()));
            catalogs.put(appId, Collections.unmodifiableSortedMap(catalog));
            return catalog.size();
        });

        int count = registered.orElseThrow(() ->
            new IllegalStateException("Timed out waiting for permission registry lock for app " + appId));
        long classified = catalog.values().stream().filter(PermissionMetadata::isClassified).count();
        LOG.infof("Registered %d permissions (%d classified) for app %s", count, classified, appId);
        return count;
    }

    /**
     * All catalog entries for the application, sorted by key.
     */
    public List<PermissionMetadata> getAppPermissions(String appId) {
        return new ArrayList<>(catalog(appId).values());
    }

    public Optional<PermissionMetadata> getPermission(String appId, String permissionKey) {
        return Optional.ofNullable(catalog(appId).get(PermissionKey.normalize(permissionKey)));
    }

    private SortedMap<String, PermissionMetadata> catalog(String appId) {
        return catalogs.computeIfAbsent(appId, id -> {
            SortedMap<String, PermissionMetadata> loaded = new TreeMap<>();
            for (PermissionMetadata permission : catalogRepository.findByAppId(id)) {
                loaded.put(permission.permissionKey(), permission);
            }
            LOG.debugf("Loaded %d catalog entries for app %s from store", loaded.size(), id);
            return Collections.unmodifiableSortedMap(loaded);
        });
    }

    // ========================================================================
    // Role writes
    // ========================================================================

    public Result<RoleWriteOutcome> createOrUpdateRole(String appId, String roleName, Set<String> allowed,
            Set<String> denied, Map<String, Map<String, List<FilterClause>>> rlsFilters, String description) {
        return createOrUpdateRole(appId, new RoleRequest(roleName, allowed, denied, rlsFilters, description, null));
    }

    /**
     * Create the role, or update it in place if the name already exists for the application.
     *
     * <p>Each requested key is normalized and then resolved by the first rule that applies:
     * <ol>
     *   <li>{@code *}: kept, plus the whole catalog</li>
     *   <li>{@code prefix.*} covering at least one catalog key: kept, plus every covered key</li>
     *   <li>exact catalog match: kept</li>
     *   <li>category key ({@code app.resource.pii}): kept. Category permissions are synthesized
     *       from sensitivity flags and never stored as catalog rows, so they cannot be checked
     *       against the catalog. This is a compatibility accommodation and weakens validation.</li>
     *   <li>anything else: dropped, logged and reported in {@link RoleWriteOutcome#rejected()}</li>
     * </ol>
     * A malformed key fails the whole write with a validation error and nothing is stored.
     */
    public Result<RoleWriteOutcome> createOrUpdateRole(String appId, RoleRequest request) {
        Result<List<RoleWriteOutcome>> result = upsertRoles(appId, List.of(request));
        return result.map(outcomes -> outcomes.get(0));
    }

    /**
     * Create or update several roles in one transaction. Either all are written or none.
     */
    public Result<List<RoleWriteOutcome>> upsertRoles(String appId, List<RoleRequest> requests) {
        if (!applicationRepository.existsByAppId(appId)) {
            return Result.failure(UseCaseError.notFound("APPLICATION_NOT_FOUND",
                "Application not found: " + appId, Map.of("appId", appId)));
        }

        Set<String> seen = new HashSet<>();
        for (RoleRequest request : requests) {
            if (request.roleName() == null || request.roleName().isBlank()) {
                return Result.failure(UseCaseError.validation("ROLE_NAME_REQUIRED", "Role name is required"));
            }
            if (!seen.add(request.roleName())) {
                return Result.failure(UseCaseError.validation("DUPLICATE_ROLE",
                    "Role " + request.roleName() + " appears more than once in the request",
                    Map.of("roleName", request.roleName())));
            }
        }

        Optional<Result<List<RoleWriteOutcome>>> locked = lock.withLock(LOCK_PREFIX + appId, lockTimeout,
            () -> writeRoles(appId, requests));

        return locked.orElseGet(() -> Result.failure(UseCaseError.concurrency("REGISTRY_BUSY",
            "Another write for this application is in progress", Map.of("appId", appId))));
    }

    private Result<List<RoleWriteOutcome>> writeRoles(String appId, List<RoleRequest> requests) {
        SortedMap<String, PermissionMetadata> catalog = catalog(appId);
        Map<String, Role> current = roles(appId);

        List<RoleWriteOutcome> outcomes = new ArrayList<>();
        for (RoleRequest request : requests) {
            List<String> rejected = new ArrayList<>();
            Set<String> allowed;
            Set<String> denied;
            try {
                allowed = resolveKeys(appId, request.allowedPermissions(), catalog, rejected, "allowed");
                denied = resolveKeys(appId, request.deniedPermissions(), catalog, rejected, "denied");
            } catch (MalformedPermissionKeyException e) {
                return Result.failure(UseCaseError.validation("MALFORMED_PERMISSION_KEY", e.getMessage(),
                    Map.of("roleName", request.roleName(), "permissionKey", String.valueOf(e.getRawKey()))));
            }

            Role existing = current.get(request.roleName());
            Role role = existing != null
                ? existing.copy()
                : new Role(TsidGenerator.generate(EntityType.ROLE), appId, request.roleName());
            role.allowedPermissions = allowed;
            role.deniedPermissions = denied;
            role.rlsFilters = RlsFilters.copyOf(request.rlsFilters());
            if (request.description() != null) {
                role.description = request.description();
            }
            if (request.active() != null) {
                role.active = request.active();
            }
            if (existing == null) {
                role.createdAt = Instant.now();
            }
            role.updatedAt = Instant.now();

            outcomes.add(new RoleWriteOutcome(role, Collections.unmodifiableSet(allowed),
                Collections.unmodifiableSet(denied), List.copyOf(rejected), existing == null));
        }

        unitOfWork.inTransaction(() -> {
            for (RoleWriteOutcome outcome : outcomes) {
                if (outcome.created()) {
                    roleRepository.persist(outcome.role());
                } else {
                    roleRepository.update(outcome.role());
                }
            }
        });

        Map<String, Role> refreshed = new ConcurrentHashMap<>(current);
        for (RoleWriteOutcome outcome : outcomes) {
            refreshed.put(outcome.role().roleName, outcome.role().copy());
            LOG.infof("%s role %s for app %s: %d allowed, %d denied, %d RLS clauses, %d rejected",
                outcome.created() ? "Created" : "Updated", outcome.role().roleName, appId,
                outcome.validAllowed().size(), outcome.validDenied().size(),
                RlsFilters.clauseCount(outcome.role().rlsFilters), outcome.rejected().size());
        }
        roles.put(appId, refreshed);

        return Result.success(outcomes);
    }

    private Set<String> resolveKeys(String appId, Set<String> requested, SortedMap<String, PermissionMetadata> catalog,
                                    List<String> rejected, String kind) {
        Set<String> resolved = new TreeSet<>();
        for (String raw : requested) {
            PermissionKey key = PermissionKey.parse(raw);
            String text = key.value();

            if (PermissionKey.WILDCARD.equals(text)) {
                resolved.add(text);
                resolved.addAll(catalog.keySet());
                continue;
            }
            if (!appId.equals(key.appId())) {
                LOG.warnf("Rejected %s permission %s for app %s: key belongs to another application",
                    kind, text, appId);
                rejected.add(text);
                continue;
            }
            // a wildcard is expanded even when it is itself a catalog row
            if (key.isWildcard()) {
                List<String> covered = catalog.keySet().stream()
                    .filter(candidate -> PermissionKey.covers(text, candidate))
                    .toList();
                if (!covered.isEmpty()) {
                    resolved.add(text);
                    resolved.addAll(covered);
                    continue;
                }
            }
            if (catalog.containsKey(text)) {
                resolved.add(text);
                continue;
            }
            if (key.isCategory()) {
                resolved.add(text);
                continue;
            }
            LOG.warnf("Rejected %s permission %s for app %s: not found in catalog", kind, text, appId);
            rejected.add(text);
        }
        return resolved;
    }

    /**
     * Delete a role together with its permissions and row filters.
     */
    public Result<Role> deleteRole(String appId, String roleName) {
        Optional<Result<Role>> locked = lock.withLock(LOCK_PREFIX + appId, lockTimeout, () -> {
            Role existing = roles(appId).get(roleName);
            if (existing == null) {
                return Result.<Role>failure(UseCaseError.notFound("ROLE_NOT_FOUND",
                    "Role " + roleName + " not found for app " + appId,
                    Map.of("appId", appId, "roleName", roleName)));
            }
            unitOfWork.inTransaction(() -> roleRepository.delete(existing));

            Map<String, Role> refreshed = new ConcurrentHashMap<>(roles(appId));
            refreshed.remove(roleName);
            roles.put(appId, refreshed);
            LOG.infof("Deleted role %s for app %s", roleName, appId);
            return Result.success(existing.copy());
        });

        return locked.orElseGet(() -> Result.failure(UseCaseError.concurrency("REGISTRY_BUSY",
            "Another write for this application is in progress", Map.of("appId", appId))));
    }

    /**
     * Remove the application's catalog and roles from the store. Runs in the caller's
     * transaction; the in-memory view is evicted by {@link #evictApplication(String)} once
     * that transaction has committed.
     */
    public void deleteApplicationData(String appId) {
        long roleCount = roleRepository.deleteByAppId(appId);
        long permissionCount = catalogRepository.deleteByAppId(appId);
        LOG.infof("Removed %d roles and %d permissions for app %s", roleCount, permissionCount, appId);
    }

    public void evictApplication(String appId) {
        catalogs.remove(appId);
        roles.remove(appId);
    }

    // ========================================================================
    // Role reads
    // ========================================================================

    public Optional<Role> getRole(String appId, String roleName) {
        return Optional.ofNullable(roles(appId).get(roleName)).map(Role::copy);
    }

    public List<Role> listRoles(String appId) {
        return roles(appId).values().stream()
            .sorted((a, b) -> a.roleName.compareTo(b.roleName))
            .map(Role::copy)
            .toList();
    }

    private Map<String, Role> roles(String appId) {
        return roles.computeIfAbsent(appId, id -> {
            Map<String, Role> loaded = new ConcurrentHashMap<>();
            for (Role role : roleRepository.findByAppId(id)) {
                loaded.put(role.roleName, role);
            }
            return loaded;
        });
    }

    private List<Role> activeRoles(String appId, Collection<String> roleNames) {
        Map<String, Role> appRoles = roles(appId);
        List<Role> result = new ArrayList<>();
        for (String roleName : roleNames) {
            Role role = appRoles.get(roleName);
            if (role != null && role.active) {
                result.add(role);
            }
        }
        return result;
    }

    // ========================================================================
    // Resolution
    // ========================================================================

    /**
     * The subset of {@code roleNames} that exist for the application and are active, sorted.
     */
    public Set<String> activeRoleNames(String appId, Collection<String> roleNames) {
        Set<String> names = new TreeSet<>();
        for (Role role : activeRoles(appId, roleNames)) {
            names.add(role.roleName);
        }
        return names;
    }

    /**
     * Union of the roles' allowed keys minus everything their denials cover.
     *
     * <p>An allowed wildcard that a denial cuts into is dropped from the result; its
     * covered catalog keys, expanded when the role was written, remain individually, so the
     * returned set never grants a denied key by way of a wildcard.
     */
    public Set<String> getEffectivePermissions(String appId, Collection<String> roleNames) {
        Set<String> allowed = new TreeSet<>();
        Set<String> denied = new TreeSet<>();
        for (Role role : activeRoles(appId, roleNames)) {
            allowed.addAll(role.allowedPermissions);
            denied.addAll(role.deniedPermissions);
        }

        Set<String> effective = new TreeSet<>();
        for (String key : allowed) {
            if (!matches(denied, key)) {
                effective.add(key);
            }
        }
        effective.removeIf(key -> isWildcardText(key)
            && denied.stream().anyMatch(d -> PermissionKey.covers(key, d)));
        return effective;
    }

    /**
     * True if the key is allowed (exactly or by an ancestor wildcard) by one of the roles
     * and not denied under the same matching by any of them.
     */
    public boolean checkPermission(String appId, Collection<String> roleNames, String permissionKey) {
        String key = PermissionKey.normalize(permissionKey);
        Set<String> allowed = new HashSet<>();
        Set<String> denied = new HashSet<>();
        for (Role role : activeRoles(appId, roleNames)) {
            allowed.addAll(role.allowedPermissions);
            denied.addAll(role.deniedPermissions);
        }
        return matches(allowed, key) && !matches(denied, key);
    }

    private static boolean matches(Set<String> keys, String key) {
        if (keys.contains(key)) {
            return true;
        }
        for (String wildcard : PermissionKey.ancestorWildcards(key)) {
            if (keys.contains(wildcard)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWildcardText(String key) {
        return PermissionKey.WILDCARD.equals(key) || key.endsWith(".*");
    }

    /**
     * Row filters of the roles, merged per resource and field by concatenation.
     */
    public Map<String, Map<String, List<FilterClause>>> getRoleRLSFilters(String appId, Collection<String> roleNames) {
        List<Map<String, Map<String, List<FilterClause>>>> filterMaps = new ArrayList<>();
        for (Role role : activeRoles(appId, roleNames)) {
            filterMaps.add(role.rlsFilters);
        }
        return RlsFilters.merge(filterMaps);
    }

    // ========================================================================
    // Administration queries
    // ========================================================================

    public List<PermissionMetadata> searchPermissions(PermissionSearchCriteria criteria) {
        List<String> appIds = criteria.appId() != null
            ? List.of(criteria.appId())
            : catalogRepository.findAppIds();
        List<PermissionMetadata> results = new ArrayList<>();
        for (String appId : appIds) {
            for (PermissionMetadata permission : catalog(appId).values()) {
                if (criteria.matches(permission)) {
                    results.add(permission);
                }
            }
        }
        return results;
    }

    /**
     * Catalog grouped as {@code resource -> action -> node}.
     */
    public Map<String, Map<String, PermissionTreeNode>> getPermissionTree(String appId) {
        Map<String, Map<String, List<PermissionMetadata>>> grouped = new TreeMap<>();
        for (PermissionMetadata permission : catalog(appId).values()) {
            grouped.computeIfAbsent(permission.resource(), r -> new TreeMap<>())
                .computeIfAbsent(permission.action(), a -> new ArrayList<>())
                .add(permission);
        }

        Map<String, Map<String, PermissionTreeNode>> tree = new LinkedHashMap<>();
        grouped.forEach((resource, actions) -> {
            Map<String, PermissionTreeNode> nodes = new LinkedHashMap<>();
            actions.forEach((action, permissions) -> {
                List<PermissionMetadata> fields = permissions.stream().filter(p -> !p.isWildcard()).toList();
                boolean hasWildcard = permissions.stream().anyMatch(PermissionMetadata::isWildcard);
                int sensitiveCount = (int) fields.stream().filter(PermissionMetadata::isClassified).count();
                nodes.put(action, new PermissionTreeNode(fields, hasWildcard, sensitiveCount));
            });
            tree.put(resource, nodes);
        });
        return tree;
    }

    /**
     * Classified catalog entries grouped by flag. A field carrying several flags is listed under each.
     */
    public Map<PermissionCategory, List<PermissionMetadata>> getSensitivePermissions(String appId) {
        Map<PermissionCategory, List<PermissionMetadata>> result = new EnumMap<>(PermissionCategory.class);
        result.put(PermissionCategory.SENSITIVE, new ArrayList<>());
        result.put(PermissionCategory.PII, new ArrayList<>());
        result.put(PermissionCategory.PHI, new ArrayList<>());
        result.put(PermissionCategory.FINANCIAL, new ArrayList<>());
        for (PermissionMetadata permission : catalog(appId).values()) {
            if (permission.sensitive()) {
                result.get(PermissionCategory.SENSITIVE).add(permission);
            }
            if (permission.pii()) {
                result.get(PermissionCategory.PII).add(permission);
            }
            if (permission.phi()) {
                result.get(PermissionCategory.PHI).add(permission);
            }
            if (permission.financial()) {
                result.get(PermissionCategory.FINANCIAL).add(permission);
            }
        }
        return result;
    }

    /**
     * Catalog overview with suggested viewer, editor and admin roles. Viewer and editor
     * suggest at most ten unclassified keys each, in key order.
     */
    public RoleTemplate exportRoleTemplate(String appId) {
        SortedMap<String, PermissionMetadata> catalog = catalog(appId);

        Map<String, RoleTemplate.SuggestedRole> exampleRoles = new LinkedHashMap<>();
        exampleRoles.put("viewer", new RoleTemplate.SuggestedRole("Read-only access to non-sensitive data",
            suggest(catalog, Set.of(PermissionExpander.ACTION_READ))));
        exampleRoles.put("editor", new RoleTemplate.SuggestedRole("Read and write access to non-sensitive data",
            suggest(catalog, EDITOR_ACTIONS)));
        exampleRoles.put("admin", new RoleTemplate.SuggestedRole("Full access including sensitive data",
            List.of(PermissionKey.WILDCARD)));

        return new RoleTemplate(appId, getPermissionTree(appId), getSensitivePermissions(appId), catalog.size(),
            exampleRoles);
    }

    private static List<String> suggest(SortedMap<String, PermissionMetadata> catalog, Set<String> actions) {
        return catalog.values().stream()
            .filter(permission -> actions.contains(permission.action()) && !permission.isClassified())
            .map(PermissionMetadata::permissionKey)
            .limit(SUGGESTED_PERMISSION_LIMIT)
            .toList();
    }
}
