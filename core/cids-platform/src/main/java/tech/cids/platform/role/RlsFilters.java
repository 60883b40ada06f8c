package tech.cids.platform.role;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Helpers for row-level security filter maps ({@code resource -> field -> clauses}).
 */
public final class RlsFilters {

    private RlsFilters() {
    }

    /**
     * Merge filter maps by concatenating clause lists per resource and field.
     * Clauses keep the order of the input maps; no input ever removes another's clauses.
     */
    public static Map<String, Map<String, List<FilterClause>>> merge(
            Collection<Map<String, Map<String, List<FilterClause>>>> filterMaps) {
        Map<String, Map<String, List<FilterClause>>> merged = new TreeMap<>();
        for (Map<String, Map<String, List<FilterClause>>> filters : filterMaps) {
            if (filters == null) {
                continue;
            }
            filters.forEach((resource, fields) -> {
                if (fields == null) {
                    return;
                }
                Map<String, List<FilterClause>> mergedFields = merged.computeIfAbsent(resource, r -> new TreeMap<>());
                fields.forEach((field, clauses) -> {
                    if (clauses != null) {
                        mergedFields.computeIfAbsent(field, f -> new ArrayList<>()).addAll(clauses);
                    }
                });
            });
        }
        return merged;
    }

    /**
     * Deep copy into mutable maps.
     */
    public static Map<String, Map<String, List<FilterClause>>> copyOf(Map<String, Map<String, List<FilterClause>>> filters) {
        Map<String, Map<String, List<FilterClause>>> copy = new LinkedHashMap<>();
        if (filters == null) {
            return copy;
        }
        filters.forEach((resource, fields) -> {
            Map<String, List<FilterClause>> fieldCopy = new LinkedHashMap<>();
            if (fields != null) {
                fields.forEach((field, clauses) -> fieldCopy.put(field, clauses != null ? new ArrayList<>(clauses) : new ArrayList<>()));
            }
            copy.put(resource, fieldCopy);
        });
        return copy;
    }

    public static int clauseCount(Map<String, Map<String, List<FilterClause>>> filters) {
        int count = 0;
        if (filters == null) {
            return 0;
        }
        for (Map<String, List<FilterClause>> fields : filters.values()) {
            for (List<FilterClause> clauses : fields.values()) {
                count += clauses.size();
            }
        }
        return count;
    }
}
