package tech.cids.platform.policy;

import tech.cids.platform.role.FilterClause;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * What a caller holds in one application: role names, effective permission keys and merged
 * row filters. Computed per token request and never stored.
 */
public record EffectiveGrant(
    String appId,
    SortedSet<String> roles,
    SortedSet<String> permissions,
    Map<String, Map<String, List<FilterClause>>> rlsFilters
) {
    public EffectiveGrant {
        roles = Collections.unmodifiableSortedSet(new TreeSet<>(roles));
        permissions = Collections.unmodifiableSortedSet(new TreeSet<>(permissions));
        rlsFilters = rlsFilters != null ? Collections.unmodifiableMap(rlsFilters) : Map.of();
    }

    /**
     * A copy with extra permission keys added.
     */
    public EffectiveGrant withAdditionalPermissions(Iterable<String> extra) {
        SortedSet<String> merged = new TreeSet<>(permissions);
        extra.forEach(merged::add);
        return new EffectiveGrant(appId, roles, merged, rlsFilters);
    }
}
