package tech.cids.platform.discovery.model;

import java.util.List;

/**
 * One HTTP operation published in a capability description.
 */
public record Endpoint(
    HttpMethod method,
    String path,
    String operationId,
    String description,
    List<String> tags,
    List<FieldNode> responseFields,
    List<FieldNode> requestFields,
    List<String> requiredRoles
) {
    public Endpoint {
        tags = tags != null ? List.copyOf(tags) : List.of();
        responseFields = responseFields != null ? List.copyOf(responseFields) : List.of();
        requestFields = requestFields != null ? List.copyOf(requestFields) : List.of();
        requiredRoles = requiredRoles != null ? List.copyOf(requiredRoles) : List.of();
    }

    /**
     * A path that does not end in a parameter segment addresses a collection.
     */
    public boolean isCollection() {
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return !trimmed.endsWith("}");
    }
}
