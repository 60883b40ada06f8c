package tech.cids.platform.token.template;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.common.Result;
import tech.cids.platform.common.UnitOfWork;
import tech.cids.platform.common.errors.UseCaseError;
import tech.cids.platform.shared.EntityType;
import tech.cids.platform.shared.TsidGenerator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Selects and applies token templates, and maintains them.
 *
 * <p>Selection: among enabled templates with groups, the highest-priority one sharing a group
 * with the user wins. Failing that, the highest-priority enabled default template applies.
 * With neither, claims pass through untouched. Equal priorities are settled by name.
 */
@ApplicationScoped
public class TokenTemplateService {

    private static final Logger LOG = Logger.getLogger(TokenTemplateService.class);

    public static final String CLAIM_TEMPLATE_APPLIED = "_template_applied";
    public static final String CLAIM_TEMPLATE_PRIORITY = "_template_priority";

    /**
     * Claims no template can remove.
     */
    public static final List<String> PRESERVED_CLAIMS = List.of(
        "iss", "sub", "aud", "exp", "iat", "nbf", "jti", "token_type", "token_version",
        "email", "name", "bound_ip", "bound_device");

    @Inject
    TokenTemplateRepository templateRepository;

    @Inject
    UnitOfWork unitOfWork;

    public Optional<TokenTemplate> findMatchingTemplate(Collection<String> userGroups) {
        Set<String> groups = userGroups != null ? new HashSet<>(userGroups) : Set.of();
        TokenTemplate bestGroupTemplate = null;
        TokenTemplate bestDefault = null;

        for (TokenTemplate template : templateRepository.findEnabled()) {
            if (template.isDefault()) {
                if (outranks(template, bestDefault)) {
                    bestDefault = template;
                }
            } else if (template.groups.stream().anyMatch(groups::contains) && outranks(template, bestGroupTemplate)) {
                bestGroupTemplate = template;
            }
        }
        return Optional.ofNullable(bestGroupTemplate != null ? bestGroupTemplate : bestDefault);
    }

    // equal priorities go to the alphabetically first name
    private static boolean outranks(TokenTemplate candidate, TokenTemplate current) {
        if (current == null) {
            return true;
        }
        if (candidate.priority != current.priority) {
            return candidate.priority > current.priority;
        }
        return candidate.name.compareTo(current.name) < 0;
    }

    /**
     * Filter composed claims through the template matching the user's groups.
     *
     * @return a new map; {@code claims} is not modified
     */
    public Map<String, Object> apply(Map<String, Object> claims, Collection<String> userGroups) {
        Optional<TokenTemplate> match = findMatchingTemplate(userGroups);
        if (match.isEmpty()) {
            return new LinkedHashMap<>(claims);
        }
        TokenTemplate template = match.get();

        Map<String, Object> filtered = new LinkedHashMap<>();
        for (TemplateClaim claim : template.claims) {
            if (claim.key() == null || claim.key().isBlank() || !claim.include()) {
                continue;
            }
            if (claims.containsKey(claim.key())) {
                filtered.put(claim.key(), claims.get(claim.key()));
            } else if (claim.value() != null) {
                filtered.put(claim.key(), claim.value());
            } else if ("array".equals(claim.type())) {
                filtered.put(claim.key(), List.of());
            } else if ("object".equals(claim.type())) {
                filtered.put(claim.key(), Map.of());
            }
        }
        for (String key : PRESERVED_CLAIMS) {
            if (claims.containsKey(key) && !filtered.containsKey(key)) {
                filtered.put(key, claims.get(key));
            }
        }
        filtered.put(CLAIM_TEMPLATE_APPLIED, template.name);
        filtered.put(CLAIM_TEMPLATE_PRIORITY, template.priority);

        LOG.debugf("Applied token template [%s] (priority %d): %d of %d claims kept",
            template.name, template.priority, filtered.size() - 2, claims.size());
        return filtered;
    }

    // ========================================================================
    // Administration
    // ========================================================================

    /**
     * Create the template, or replace the stored one with the same name.
     */
    public Result<TokenTemplate> saveTemplate(TokenTemplate template) {
        List<String> problems = validate(template);
        if (!problems.isEmpty()) {
            return Result.failure(UseCaseError.validation("INVALID_TOKEN_TEMPLATE",
                "Token template has " + problems.size() + " problem(s)", Map.of("problems", problems)));
        }

        TokenTemplate saved = unitOfWork.inTransaction(() -> {
            Optional<TokenTemplate> existing = templateRepository.findByName(template.name);
            if (existing.isPresent()) {
                TokenTemplate stored = existing.get();
                stored.description = template.description;
                stored.groups = new ArrayList<>(template.groups);
                stored.priority = template.priority;
                stored.enabled = template.enabled;
                stored.claims = new ArrayList<>(template.claims);
                templateRepository.update(stored);
                return stored;
            }
            template.id = TsidGenerator.generate(EntityType.TOKEN_TEMPLATE);
            templateRepository.persist(template);
            return template;
        });
        LOG.infof("Saved token template [%s] (priority %d, %d groups, %d claims)",
            saved.name, saved.priority, saved.groups.size(), saved.claims.size());
        return Result.success(saved);
    }

    public Result<Void> deleteTemplate(String name) {
        boolean deleted = unitOfWork.inTransaction(() -> templateRepository.deleteByName(name));
        if (!deleted) {
            return Result.failure(UseCaseError.notFound("TEMPLATE_NOT_FOUND",
                "Token template not found: " + name, Map.of("name", String.valueOf(name))));
        }
        LOG.infof("Deleted token template [%s]", name);
        return Result.success(null);
    }

    public Optional<TokenTemplate> getTemplate(String name) {
        return templateRepository.findByName(name);
    }

    public List<TokenTemplate> listTemplates() {
        return templateRepository.listTemplates();
    }

    private static List<String> validate(TokenTemplate template) {
        List<String> problems = new ArrayList<>();
        if (template.name == null || template.name.isBlank()) {
            problems.add("name is required");
        }
        Set<String> keys = new HashSet<>();
        int index = 0;
        for (TemplateClaim claim : template.claims) {
            String where = "claims[" + index++ + "]";
            if (claim.key() == null || claim.key().isBlank()) {
                problems.add(where + ": key is required");
            } else if (!keys.add(claim.key())) {
                problems.add(where + ": duplicate claim " + claim.key());
            }
            if (claim.type() != null && !"array".equals(claim.type()) && !"object".equals(claim.type())
                    && !"string".equals(claim.type()) && !"number".equals(claim.type())
                    && !"boolean".equals(claim.type())) {
                problems.add(where + ": unsupported type " + claim.type());
            }
        }
        for (String group : template.groups) {
            if (group == null || group.isBlank()) {
                problems.add("groups must not contain blank names");
                break;
            }
        }
        return problems;
    }
}
