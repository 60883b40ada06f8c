package tech.cids.platform.policy.document.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.policy.document.PolicyDocument;
import tech.cids.platform.policy.document.PolicyDocumentRepository;
import tech.cids.platform.policy.document.entity.PolicyDocumentEntity;
import tech.cids.platform.policy.document.mapper.PolicyDocumentMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of PolicyDocumentRepository.
 */
@ApplicationScoped
public class PanachePolicyDocumentRepository
    implements PolicyDocumentRepository, PanacheRepositoryBase<PolicyDocumentEntity, String> {

    @Override
    public Optional<PolicyDocument> findByPolicyId(String policyId) {
        return find("policyId", policyId)
            .firstResultOptional()
            .map(PolicyDocumentMapper::toDomain);
    }

    @Override
    public Optional<PolicyDocument> findActive() {
        return find("active", true)
            .firstResultOptional()
            .map(PolicyDocumentMapper::toDomain);
    }

    @Override
    public List<PolicyDocument> listDocuments() {
        return find("order by policyId").list().stream()
            .map(PolicyDocumentMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(PolicyDocument document) {
        if (document.createdAt == null) {
            document.createdAt = Instant.now();
        }
        document.updatedAt = Instant.now();
        persist(PolicyDocumentMapper.toEntity(document));
    }

    @Override
    public void update(PolicyDocument document) {
        document.updatedAt = Instant.now();
        PolicyDocumentEntity entity = findById(document.id);
        if (entity != null) {
            PolicyDocumentMapper.updateEntity(entity, document);
        }
    }

    @Override
    public void activate(String policyId) {
        Instant now = Instant.now();
        update("active = false, updatedAt = ?1 where active = true and policyId <> ?2", now, policyId);
        update("active = true, updatedAt = ?1 where policyId = ?2", now, policyId);
    }
}
