package tech.cids.platform.policy.document.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.cids.platform.policy.abac.AbacRule;
import tech.cids.platform.policy.document.PolicyDocument;
import tech.cids.platform.policy.document.RoleMatrixEntry;
import tech.cids.platform.policy.document.entity.PolicyDocumentEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * Mapper for converting between PolicyDocument domain model and JPA entity.
 */
public final class PolicyDocumentMapper {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<List<RoleMatrixEntry>> MATRIX_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<AbacRule>> RULES_TYPE = new TypeReference<>() {};

    private PolicyDocumentMapper() {
    }

    public static PolicyDocument toDomain(PolicyDocumentEntity entity) {
        if (entity == null) {
            return null;
        }
        PolicyDocument domain = new PolicyDocument();
        domain.id = entity.id;
        domain.policyId = entity.policyId;
        domain.version = entity.version;
        domain.description = entity.description;
        domain.roleMatrix = read(entity.policyId, "role_matrix", entity.roleMatrix, MATRIX_TYPE);
        domain.abacRules = read(entity.policyId, "abac_rules", entity.abacRules, RULES_TYPE);
        domain.active = entity.active;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static PolicyDocumentEntity toEntity(PolicyDocument domain) {
        if (domain == null) {
            return null;
        }
        PolicyDocumentEntity entity = new PolicyDocumentEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(PolicyDocumentEntity entity, PolicyDocument domain) {
        entity.policyId = domain.policyId;
        entity.version = domain.version;
        entity.description = domain.description;
        entity.roleMatrix = write(domain.roleMatrix);
        entity.abacRules = write(domain.abacRules);
        entity.active = domain.active;
        entity.updatedAt = domain.updatedAt;
    }

    private static <T> List<T> read(String policyId, String column, String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored " + column + " for policy " + policyId + " are not valid JSON", e);
        }
    }

    private static String write(List<?> values) {
        try {
            return objectMapper.writeValueAsString(values != null ? values : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize policy document", e);
        }
    }
}
