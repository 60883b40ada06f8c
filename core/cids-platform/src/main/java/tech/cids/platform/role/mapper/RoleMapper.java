package tech.cids.platform.role.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.cids.platform.role.FilterClause;
import tech.cids.platform.role.Role;
import tech.cids.platform.role.entity.RoleEntity;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Mapper for converting between Role domain model and JPA entity.
 */
public final class RoleMapper {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<Map<String, Map<String, List<FilterClause>>>> RLS_TYPE =
        new TypeReference<>() {};

    private RoleMapper() {
    }

    public static Role toDomain(RoleEntity entity) {
        if (entity == null) {
            return null;
        }

        Role domain = new Role();
        domain.id = entity.id;
        domain.appId = entity.appId;
        domain.roleName = entity.roleName;
        domain.allowedPermissions = entity.allowedPermissions != null
            ? new TreeSet<>(Arrays.asList(entity.allowedPermissions))
            : new TreeSet<>();
        domain.deniedPermissions = entity.deniedPermissions != null
            ? new TreeSet<>(Arrays.asList(entity.deniedPermissions))
            : new TreeSet<>();
        domain.rlsFilters = parseRlsFilters(entity.id, entity.rlsFilters);
        domain.description = entity.description;
        domain.active = entity.active;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static RoleEntity toEntity(Role domain) {
        if (domain == null) {
            return null;
        }

        RoleEntity entity = new RoleEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(RoleEntity entity, Role domain) {
        entity.appId = domain.appId;
        entity.roleName = domain.roleName;
        entity.allowedPermissions = domain.allowedPermissions != null
            ? domain.allowedPermissions.toArray(new String[0])
            : new String[0];
        entity.deniedPermissions = domain.deniedPermissions != null
            ? domain.deniedPermissions.toArray(new String[0])
            : new String[0];
        entity.rlsFilters = toJson(domain.rlsFilters);
        entity.description = domain.description;
        entity.active = domain.active;
        entity.updatedAt = domain.updatedAt;
    }

    static Map<String, Map<String, List<FilterClause>>> parseRlsFilters(String roleId, String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, RLS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored rls_filters for role " + roleId + " are not valid JSON", e);
        }
    }

    static String toJson(Map<String, Map<String, List<FilterClause>>> filters) {
        try {
            return objectMapper.writeValueAsString(filters != null ? filters : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rls_filters", e);
        }
    }
}
