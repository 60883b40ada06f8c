package tech.cids.platform.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.policy.EffectiveGrant;
import tech.cids.platform.policy.PolicyResolver;
import tech.cids.platform.policy.abac.AbacRequest;
import tech.cids.platform.role.FilterClause;
import tech.cids.platform.token.template.TokenTemplateService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds access-token claims from a user's groups and the persisted role state.
 *
 * <p>Claim shape:
 * <pre>
 * sub, email, name, groups
 * roles:        {appId: [role]}
 * permissions:  {appId: [key]}                                  sorted, apps without keys omitted
 * rls_filters:  {appId: {resource: {field: [clause]}}}          apps without filters omitted
 * bound_ip, bound_device                                        only when present
 * token_type:   "access"
 * token_version "2.0"
 * </pre>
 * Composition never triggers discovery; it reads whatever the last successful run stored.
 */
@ApplicationScoped
public class ClaimsComposer {

    private static final Logger LOG = Logger.getLogger(ClaimsComposer.class);

    public static final String TOKEN_VERSION = "2.0";
    public static final String TOKEN_TYPE_ACCESS = "access";

    public static final String CLAIM_SUB = "sub";
    public static final String CLAIM_AUD = "aud";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_NAME = "name";
    public static final String CLAIM_GROUPS = "groups";
    public static final String CLAIM_ROLES = "roles";
    public static final String CLAIM_PERMISSIONS = "permissions";
    public static final String CLAIM_RLS_FILTERS = "rls_filters";
    public static final String CLAIM_BOUND_IP = "bound_ip";
    public static final String CLAIM_BOUND_DEVICE = "bound_device";
    public static final String CLAIM_TOKEN_TYPE = "token_type";
    public static final String CLAIM_TOKEN_VERSION = "token_version";

    @Inject
    PolicyResolver policyResolver;

    @Inject
    TokenTemplateService templateService;

    /**
     * Claims after the matching token template has been applied.
     *
     * @param targetAppId restrict roles and permissions to this application; null for all
     */
    public Map<String, Object> composeClaims(AuthenticatedUser user, String targetAppId) {
        return templateService.apply(buildClaims(user, targetAppId), user.groups());
    }

    /**
     * The full claim map, before any template.
     */
    public Map<String, Object> buildClaims(AuthenticatedUser user, String targetAppId) {
        Map<String, EffectiveGrant> grants = policyResolver.resolve(
            new AbacRequest(user.subject(), Set.copyOf(user.groups()), Map.of()), targetAppId);

        Map<String, Object> roles = new TreeMap<>();
        Map<String, Object> permissions = new TreeMap<>();
        Map<String, Object> rlsFilters = new TreeMap<>();
        for (EffectiveGrant grant : grants.values()) {
            roles.put(grant.appId(), new ArrayList<>(grant.roles()));
            if (!grant.permissions().isEmpty()) {
                permissions.put(grant.appId(), new ArrayList<>(grant.permissions()));
            }
            if (!grant.rlsFilters().isEmpty()) {
                rlsFilters.put(grant.appId(), toClaimValue(grant.rlsFilters()));
            }
        }

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(CLAIM_SUB, user.subject());
        if (targetAppId != null) {
            claims.put(CLAIM_AUD, List.of(targetAppId));
        }
        claims.put(CLAIM_EMAIL, user.email() != null ? user.email() : "");
        claims.put(CLAIM_NAME, user.name() != null ? user.name() : "");
        claims.put(CLAIM_GROUPS, new ArrayList<>(user.groups()));
        claims.put(CLAIM_ROLES, roles);
        claims.put(CLAIM_PERMISSIONS, permissions);
        claims.put(CLAIM_RLS_FILTERS, rlsFilters);
        if (user.clientIp() != null && !user.clientIp().isBlank()) {
            claims.put(CLAIM_BOUND_IP, user.clientIp());
        }
        if (user.deviceFingerprint() != null && !user.deviceFingerprint().isBlank()) {
            claims.put(CLAIM_BOUND_DEVICE, user.deviceFingerprint());
        }
        claims.put(CLAIM_TOKEN_TYPE, TOKEN_TYPE_ACCESS);
        claims.put(CLAIM_TOKEN_VERSION, TOKEN_VERSION);

        LOG.debugf("Composed claims for %s: %d apps with roles, %d with permissions",
            user.subject(), roles.size(), permissions.size());
        return claims;
    }

    /**
     * Plain maps and lists only, so the claim serializes without custom codecs.
     */
    static Map<String, Object> toClaimValue(Map<String, Map<String, List<FilterClause>>> filters) {
        Map<String, Object> resources = new TreeMap<>();
        filters.forEach((resource, fields) -> {
            Map<String, Object> byField = new TreeMap<>();
            fields.forEach((field, clauses) -> {
                List<Map<String, Object>> values = new ArrayList<>();
                for (FilterClause clause : clauses) {
                    Map<String, Object> value = new LinkedHashMap<>();
                    value.put("filter_expression", clause.filterExpression());
                    value.put("operator", clause.operator().name());
                    value.put("priority", clause.priority());
                    values.add(value);
                }
                byField.put(field, values);
            });
            resources.put(resource, byField);
        });
        return resources;
    }
}
