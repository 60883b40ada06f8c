package tech.cids.platform.policy.document;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.common.Result;
import tech.cids.platform.common.UnitOfWork;
import tech.cids.platform.common.errors.UseCaseError;
import tech.cids.platform.permission.MalformedPermissionKeyException;
import tech.cids.platform.permission.PermissionKey;
import tech.cids.platform.policy.abac.AbacRule;
import tech.cids.platform.shared.EntityType;
import tech.cids.platform.shared.TsidGenerator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stores, validates and activates policy documents.
 *
 * <p>A document is validated as a whole before anything is written; a document with any
 * problem is rejected with every problem listed in the error details.
 */
@ApplicationScoped
public class PolicyDocumentService {

    private static final Logger LOG = Logger.getLogger(PolicyDocumentService.class);

    @Inject
    PolicyDocumentRepository policyRepository;

    @Inject
    UnitOfWork unitOfWork;

    /**
     * Create the document, or replace the stored one with the same policyId. The active
     * flag of an existing document is kept.
     */
    public Result<PolicyDocument> savePolicy(PolicyDocument document) {
        List<String> problems = validate(document);
        if (!problems.isEmpty()) {
            LOG.warnf("Rejected policy document %s: %s", document.policyId, problems);
            return Result.failure(UseCaseError.validation("INVALID_POLICY_DOCUMENT",
                "Policy document has " + problems.size() + " problem(s)", Map.of("problems", problems)));
        }

        PolicyDocument saved = unitOfWork.inTransaction(() -> {
            Optional<PolicyDocument> existing = policyRepository.findByPolicyId(document.policyId);
            if (existing.isPresent()) {
                PolicyDocument stored = existing.get();
                stored.version = document.version;
                stored.description = document.description;
                stored.roleMatrix = new ArrayList<>(document.roleMatrix);
                stored.abacRules = new ArrayList<>(document.abacRules);
                policyRepository.update(stored);
                return stored;
            }
            document.id = TsidGenerator.generate(EntityType.POLICY_DOCUMENT);
            document.active = false;
            policyRepository.persist(document);
            return document;
        });

        LOG.infof("Saved policy document %s (%d matrix entries, %d ABAC rules)",
            saved.policyId, saved.roleMatrix.size(), saved.abacRules.size());
        return Result.success(saved);
    }

    /**
     * Make the document the active one, deactivating any other.
     */
    public Result<PolicyDocument> activate(String policyId) {
        Optional<PolicyDocument> activated = unitOfWork.inTransaction(() -> {
            Optional<PolicyDocument> document = policyRepository.findByPolicyId(policyId);
            document.ifPresent(found -> {
                policyRepository.activate(policyId);
                found.active = true;
            });
            return document;
        });

        if (activated.isEmpty()) {
            return Result.failure(UseCaseError.notFound("POLICY_NOT_FOUND",
                "Policy document not found: " + policyId, Map.of("policyId", policyId)));
        }
        LOG.infof("Activated policy document %s", policyId);
        return Result.success(activated.get());
    }

    public Optional<PolicyDocument> getActivePolicy() {
        return policyRepository.findActive();
    }

    public Optional<PolicyDocument> getPolicy(String policyId) {
        return policyRepository.findByPolicyId(policyId);
    }

    public List<PolicyDocument> listPolicies() {
        return policyRepository.listDocuments();
    }

    /**
     * Every problem with the document; empty when it is valid.
     */
    public List<String> validate(PolicyDocument document) {
        List<String> problems = new ArrayList<>();
        if (document.policyId == null || document.policyId.isBlank()) {
            problems.add("policyId is required");
        }

        Set<String> seenRoles = new HashSet<>();
        int index = 0;
        for (RoleMatrixEntry entry : document.roleMatrix) {
            String where = "roleMatrix[" + index++ + "]";
            if (entry.appId() == null || entry.appId().isBlank()) {
                problems.add(where + ": appId is required");
            }
            if (entry.roleName() == null || entry.roleName().isBlank()) {
                problems.add(where + ": roleName is required");
            }
            if (!seenRoles.add(entry.appId() + "/" + entry.roleName())) {
                problems.add(where + ": duplicate role " + entry.roleName() + " for app " + entry.appId());
            }
            checkKeys(where, entry.permissions(), problems);
        }

        Set<String> seenRules = new HashSet<>();
        index = 0;
        for (AbacRule rule : document.abacRules) {
            String where = "abacRules[" + index++ + "]";
            if (rule.name() == null || rule.name().isBlank()) {
                problems.add(where + ": name is required");
            } else if (!seenRules.add(rule.name())) {
                problems.add(where + ": duplicate rule name " + rule.name());
            }
            if (rule.condition() == null || rule.condition().isBlank()) {
                problems.add(where + ": condition is required");
            }
            checkKeys(where, rule.permissions(), problems);
        }
        return problems;
    }

    private static void checkKeys(String where, List<String> keys, List<String> problems) {
        Set<String> seen = new HashSet<>();
        for (String raw : keys) {
            String key;
            try {
                key = PermissionKey.parse(raw).value();
            } catch (MalformedPermissionKeyException e) {
                problems.add(where + ": " + e.getMessage());
                continue;
            }
            if (!seen.add(key)) {
                problems.add(where + ": duplicate permission " + key);
            }
        }
    }
}
