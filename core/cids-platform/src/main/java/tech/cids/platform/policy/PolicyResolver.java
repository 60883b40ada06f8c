package tech.cids.platform.policy;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.permission.PermissionKey;
import tech.cids.platform.permission.PermissionRegistry;
import tech.cids.platform.policy.abac.AbacEvaluator;
import tech.cids.platform.policy.abac.AbacOutcome;
import tech.cids.platform.policy.abac.AbacRequest;
import tech.cids.platform.policy.abac.AbacRule;
import tech.cids.platform.policy.document.PolicyDocument;
import tech.cids.platform.policy.document.PolicyDocumentRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns a caller's identity-provider groups into effective grants per application.
 *
 * <p>Groups map to roles through {@link GroupRoleMapping}s; the registry supplies the
 * permissions and row filters of those roles. Only persisted state is read. ABAC rules of the
 * active policy document are offered to the {@link AbacEvaluator}; a rule it cannot evaluate
 * contributes nothing.
 */
@ApplicationScoped
public class PolicyResolver {

    private static final Logger LOG = Logger.getLogger(PolicyResolver.class);

    @Inject
    GroupRoleMappingRepository mappingRepository;

    @Inject
    PermissionRegistry permissionRegistry;

    @Inject
    PolicyDocumentRepository policyRepository;

    @Inject
    AbacEvaluator abacEvaluator;

    /**
     * Resolve the groups' role names per application.
     *
     * @param targetAppId restrict to this application; null for all
     * @return appId to role names, both sorted
     */
    public SortedMap<String, Set<String>> resolveRoleNames(Collection<String> groups, String targetAppId) {
        SortedMap<String, Set<String>> roleNames = new TreeMap<>();
        for (GroupRoleMapping mapping : mappingRepository.findByGroupNames(groups)) {
            if (targetAppId != null && !targetAppId.equals(mapping.appId)) {
                continue;
            }
            roleNames.computeIfAbsent(mapping.appId, k -> new TreeSet<>()).add(mapping.roleName);
        }
        return roleNames;
    }

    /**
     * Effective grants for the caller, keyed by appId in sorted order. Applications in which
     * none of the mapped roles exists or is active are left out.
     */
    public Map<String, EffectiveGrant> resolve(AbacRequest request, String targetAppId) {
        Map<String, EffectiveGrant> grants = new LinkedHashMap<>();
        resolveRoleNames(request.groups(), targetAppId).forEach((appId, mapped) -> {
            Set<String> active = permissionRegistry.activeRoleNames(appId, mapped);
            if (active.isEmpty()) {
                LOG.debugf("No active roles for app %s among %s", appId, mapped);
                return;
            }
            grants.put(appId, new EffectiveGrant(
                appId,
                new TreeSet<>(active),
                new TreeSet<>(permissionRegistry.getEffectivePermissions(appId, active)),
                permissionRegistry.getRoleRLSFilters(appId, active)));
        });

        applyAbacRules(request, grants);
        return grants;
    }

    public Map<String, EffectiveGrant> resolve(Collection<String> groups, String targetAppId) {
        return resolve(new AbacRequest(null, Set.copyOf(groups), Map.of()), targetAppId);
    }

    private void applyAbacRules(AbacRequest request, Map<String, EffectiveGrant> grants) {
        Optional<PolicyDocument> active = policyRepository.findActive();
        if (active.isEmpty() || active.get().abacRules.isEmpty()) {
            return;
        }

        for (AbacRule rule : active.get().abacRules) {
            AbacOutcome outcome = abacEvaluator.evaluate(rule, request);
            if (outcome instanceof AbacOutcome.NotImplemented notImplemented) {
                LOG.debugf("ABAC rule %s of policy %s not applied: %s",
                    rule.name(), active.get().policyId, notImplemented.reason());
            } else if (outcome instanceof AbacOutcome.Evaluated evaluated) {
                addGranted(evaluated, grants);
            }
        }
    }

    private static void addGranted(AbacOutcome.Evaluated evaluated, Map<String, EffectiveGrant> grants) {
        Map<String, List<String>> byApp = new TreeMap<>();
        for (String raw : evaluated.grantedPermissions()) {
            PermissionKey.tryParse(raw).ifPresentOrElse(
                key -> byApp.computeIfAbsent(key.appId(), k -> new ArrayList<>()).add(key.value()),
                () -> LOG.warnf("ABAC rule %s granted malformed permission key [%s]", evaluated.ruleName(), raw));
        }
        byApp.forEach((appId, keys) -> {
            EffectiveGrant grant = grants.get(appId);
            if (grant != null) {
                grants.put(appId, grant.withAdditionalPermissions(keys));
            }
        });
    }
}
