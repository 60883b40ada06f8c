package tech.cids.platform.permission;

import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.discovery.model.CapabilityDescriptor;
import tech.cids.platform.discovery.model.Endpoint;
import tech.cids.platform.discovery.model.FieldNode;
import tech.cids.platform.discovery.model.HttpMethod;
import tech.cids.platform.discovery.model.ServiceDescriptor;
import tech.cids.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Turns a capability description into field-level permission metadata.
 *
 * <p>For every endpoint:
 * <ul>
 *   <li>GET response fields become {@code app.resource.read.<path>}</li>
 *   <li>POST/PUT/PATCH request fields become {@code app.resource.write.<path>}</li>
 *   <li>one {@code app.resource.<action>.*} wildcard is emitted, where the action comes from the method</li>
 * </ul>
 * Every field node emits a key, parents included. Object children extend the path with
 * {@code .child}; children of an array of objects extend it with {@code [].child}.
 *
 * <p>Output is sorted by key and contains each key once, so expanding the same descriptor
 * twice yields the same key set.
 */
@ApplicationScoped
public class PermissionExpander {

    public static final String ACTION_READ = "read";
    public static final String ACTION_WRITE = "write";

    /**
     * Expand with a fresh discovery run ID and the current time.
     */
    public List<PermissionMetadata> expand(String appId, CapabilityDescriptor descriptor) {
        return expand(appId, descriptor, TsidGenerator.generateRaw(), Instant.now());
    }

    public List<PermissionMetadata> expand(String appId, CapabilityDescriptor descriptor,
                                           String discoveryRunId, Instant discoveredAt) {
        SortedMap<String, PermissionMetadata> permissions = new TreeMap<>();
        Context ctx = new Context(appId, discoveryRunId, discoveredAt, permissions);

        if (descriptor.endpoints() != null) {
            for (Endpoint endpoint : descriptor.endpoints()) {
                expandEndpoint(ctx, endpoint, null);
            }
        }
        if (descriptor.services() != null) {
            for (ServiceDescriptor service : descriptor.services()) {
                for (Endpoint endpoint : service.endpoints()) {
                    expandEndpoint(ctx, endpoint, service.name());
                }
            }
        }
        return new ArrayList<>(permissions.values());
    }

    private void expandEndpoint(Context ctx, Endpoint endpoint, String servicePrefix) {
        String resource = resourceFromPath(endpoint.path());
        if (servicePrefix != null) {
            resource = servicePrefix + "_" + resource;
        }
        String action = actionFromMethod(endpoint.method(), endpoint.isCollection());

        if (endpoint.method() == HttpMethod.GET && !endpoint.responseFields().isEmpty()) {
            expandFields(ctx, resource, ACTION_READ, endpoint.responseFields(), endpoint.operationId(), null);
        }
        if (endpoint.method().carriesRequestBody() && !endpoint.requestFields().isEmpty()) {
            expandFields(ctx, resource, ACTION_WRITE, endpoint.requestFields(), endpoint.operationId(), null);
        }

        String wildcardKey = PermissionKey.allFields(ctx.appId, resource, action).value();
        if (!ctx.permissions.containsKey(wildcardKey)) {
            ctx.permissions.put(wildcardKey, new PermissionMetadata(
                wildcardKey,
                resource,
                action,
                PermissionKey.WILDCARD,
                capitalize(action) + " all fields for " + resource,
                false, false, false, false,
                endpoint.operationId(),
                ctx.discoveryRunId,
                ctx.discoveredAt
            ));
        }
    }

    private void expandFields(Context ctx, String resource, String action, List<FieldNode> fields,
                              String endpointId, String parentPath) {
        for (FieldNode field : fields) {
            String fieldPath = parentPath != null ? parentPath + "." + field.name() : field.name();
            String key = PermissionKey.of(ctx.appId, resource, action, fieldPath).value();
            ctx.permissions.put(key, new PermissionMetadata(
                key,
                resource,
                action,
                fieldPath,
                field.description() != null ? field.description() : capitalize(action) + " " + fieldPath,
                field.flags().sensitive(),
                field.flags().pii(),
                field.flags().phi(),
                field.flags().financial(),
                endpointId,
                ctx.discoveryRunId,
                ctx.discoveredAt
            ));

            if (field instanceof FieldNode.ObjectField object && !object.fields().isEmpty()) {
                expandFields(ctx, resource, action, object.fields(), endpointId, fieldPath);
            } else if (field instanceof FieldNode.ArrayField array
                    && array.items() instanceof FieldNode.ObjectField item
                    && !item.fields().isEmpty()) {
                expandFields(ctx, resource, action, item.fields(), endpointId, fieldPath + "[]");
            }
        }
    }

    /**
     * Resource name for an endpoint path: a leading {@code api} segment and
     * {@code {param}} segments are dropped, the rest joined with {@code _}.
     * An empty result becomes {@code root}.
     */
    public static String resourceFromPath(String path) {
        List<String> parts = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        if (!parts.isEmpty() && parts.get(0).equals("api")) {
            parts.remove(0);
        }
        List<String> cleaned = new ArrayList<>();
        for (String part : parts) {
            if (!(part.startsWith("{") && part.endsWith("}"))) {
                cleaned.add(part);
            }
        }
        return cleaned.isEmpty() ? "root" : String.join("_", cleaned);
    }

    /**
     * Action name for a method. POST creates on a collection and updates on an item.
     */
    public static String actionFromMethod(HttpMethod method, boolean isCollection) {
        return switch (method) {
            case GET -> "read";
            case POST -> isCollection ? "create" : "update";
            case PUT, PATCH -> "update";
            case DELETE -> "delete";
            case HEAD -> "check";
            case OPTIONS -> "options";
        };
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }

    private record Context(String appId, String discoveryRunId, Instant discoveredAt,
                           SortedMap<String, PermissionMetadata> permissions) {
    }
}
