package tech.cids.platform.policy.document;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for PolicyDocument entities.
 */
public interface PolicyDocumentRepository {

    // Read operations
    Optional<PolicyDocument> findByPolicyId(String policyId);
    Optional<PolicyDocument> findActive();
    List<PolicyDocument> listDocuments();

    // Write operations
    void persist(PolicyDocument document);
    void update(PolicyDocument document);

    /**
     * Make the document the only active one. Must run inside a transaction.
     */
    void activate(String policyId);
}
