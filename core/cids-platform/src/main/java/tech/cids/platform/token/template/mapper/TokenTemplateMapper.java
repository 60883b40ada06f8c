package tech.cids.platform.token.template.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.cids.platform.token.template.TemplateClaim;
import tech.cids.platform.token.template.TokenTemplate;
import tech.cids.platform.token.template.entity.TokenTemplateEntity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mapper for converting between TokenTemplate domain model and JPA entity.
 */
public final class TokenTemplateMapper {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<List<TemplateClaim>> CLAIMS_TYPE = new TypeReference<>() {};

    private TokenTemplateMapper() {
    }

    public static TokenTemplate toDomain(TokenTemplateEntity entity) {
        if (entity == null) {
            return null;
        }
        TokenTemplate domain = new TokenTemplate();
        domain.id = entity.id;
        domain.name = entity.name;
        domain.description = entity.description;
        domain.groups = entity.groups != null ? new ArrayList<>(Arrays.asList(entity.groups)) : new ArrayList<>();
        domain.priority = entity.priority;
        domain.enabled = entity.enabled;
        domain.claims = parseClaims(entity.name, entity.claims);
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static TokenTemplateEntity toEntity(TokenTemplate domain) {
        if (domain == null) {
            return null;
        }
        TokenTemplateEntity entity = new TokenTemplateEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(TokenTemplateEntity entity, TokenTemplate domain) {
        entity.name = domain.name;
        entity.description = domain.description;
        entity.groups = domain.groups != null ? domain.groups.toArray(new String[0]) : new String[0];
        entity.priority = domain.priority;
        entity.enabled = domain.enabled;
        try {
            entity.claims = objectMapper.writeValueAsString(domain.claims != null ? domain.claims : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize claims of token template " + domain.name, e);
        }
        entity.updatedAt = domain.updatedAt;
    }

    static List<TemplateClaim> parseClaims(String templateName, String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, CLAIMS_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored claims for token template " + templateName
                + " are not valid JSON", e);
        }
    }
}
