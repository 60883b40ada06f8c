package tech.cids.platform.role;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A named role within one application.
 *
 * <p>Allowed and denied sets hold permission keys already validated against the
 * application's catalog at write time. Row filters are keyed by resource then field.
 */
public class Role {

    public String id;

    public String appId;

    public String roleName;

    public Set<String> allowedPermissions = new TreeSet<>();

    public Set<String> deniedPermissions = new TreeSet<>();

    public Map<String, Map<String, List<FilterClause>>> rlsFilters = new LinkedHashMap<>();

    public String description;

    public boolean active = true;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public Role() {
    }

    public Role(String id, String appId, String roleName) {
        this.id = id;
        this.appId = appId;
        this.roleName = roleName;
    }

    /**
     * Deep copy, so cached roles can be handed out without exposing shared state.
     */
    public Role copy() {
        Role copy = new Role(id, appId, roleName);
        copy.allowedPermissions = new TreeSet<>(allowedPermissions);
        copy.deniedPermissions = new TreeSet<>(deniedPermissions);
        copy.rlsFilters = RlsFilters.copyOf(rlsFilters);
        copy.description = description;
        copy.active = active;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
