package tech.cids.platform.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.discovery.model.CapabilityDescriptor;
import tech.cids.platform.discovery.model.Endpoint;
import tech.cids.platform.discovery.model.FieldNode;
import tech.cids.platform.discovery.model.FieldType;
import tech.cids.platform.discovery.model.HttpMethod;
import tech.cids.platform.discovery.model.SensitivityFlags;
import tech.cids.platform.discovery.model.ServiceDescriptor;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validates a raw capability document and turns it into a {@link CapabilityDescriptor}.
 *
 * <p>Keys are accepted in camelCase or snake_case. Field collections are accepted either as
 * an object keyed by field name or as an array of objects carrying a {@code name}.
 */
@ApplicationScoped
public class CapabilityParser {

    /**
     * Parse a current-format (2.x) capability document.
     *
     * @throws DiscoveryException with {@link DiscoveryErrorType#VALIDATION_ERROR} on any structural problem
     */
    public CapabilityDescriptor parse(JsonNode root) throws DiscoveryException {
        if (root == null || !root.isObject()) {
            throw DiscoveryException.validation("Discovery response must be a JSON object");
        }

        String version = text(root, "version", null);
        if (version == null) {
            version = CapabilityDescriptor.CURRENT_VERSION;
        }
        if (version.startsWith("1.")) {
            throw DiscoveryException.validation(
                "Discovery version " + version + " is no longer supported, upgrade required to version "
                    + CapabilityDescriptor.CURRENT_VERSION);
        }

        String appId = requiredText(root, "app_id", "appId");
        String appName = requiredText(root, "app_name", "appName");

        JsonNode endpointsNode = field(root, "endpoints", null);
        JsonNode servicesNode = field(root, "services", null);
        boolean hasEndpoints = endpointsNode != null && !endpointsNode.isNull();
        boolean hasServices = servicesNode != null && !servicesNode.isNull();
        if (hasEndpoints && hasServices) {
            throw DiscoveryException.validation("Cannot specify both endpoints and services");
        }
        if (!hasEndpoints && !hasServices) {
            throw DiscoveryException.validation("Must specify either endpoints or services");
        }

        List<Endpoint> endpoints = hasEndpoints ? parseEndpoints(endpointsNode, "endpoints") : null;
        List<ServiceDescriptor> services = hasServices ? parseServices(servicesNode) : null;

        return new CapabilityDescriptor(appId, appName, version, text(root, "description", null),
            endpoints, services);
    }

    /**
     * Parse the legacy 1.x document shape {@code {endpoints:[{method, path, description, required_roles}]}}.
     * Field metadata is ignored, so only endpoint-level permissions can be derived from the result.
     */
    public CapabilityDescriptor parseLegacy(JsonNode root, String appId, String appName) throws DiscoveryException {
        if (root == null || !root.isObject()) {
            throw DiscoveryException.validation("Discovery response must be a JSON object");
        }
        JsonNode endpointsNode = field(root, "endpoints", null);
        if (endpointsNode == null || !endpointsNode.isArray()) {
            throw DiscoveryException.validation("Legacy discovery response must contain an endpoints array");
        }

        List<Endpoint> endpoints = new ArrayList<>();
        int index = 0;
        for (JsonNode node : endpointsNode) {
            String where = "endpoints[" + index++ + "]";
            HttpMethod method = parseMethod(node, where);
            String path = requiredText(node, "path", null, where);
            endpoints.add(new Endpoint(
                method,
                path,
                text(node, "operation_id", "operationId", defaultOperationId(method, path)),
                text(node, "description", null),
                List.of(),
                List.of(),
                List.of(),
                textList(field(node, "required_roles", "requiredRoles"))
            ));
        }

        return new CapabilityDescriptor(
            text(root, "app_id", "appId", appId),
            text(root, "app_name", "appName", appName),
            text(root, "version", "1.0"),
            text(root, "description", null),
            endpoints,
            null
        );
    }

    // ========================================================================
    // Endpoints and services
    // ========================================================================

    private List<ServiceDescriptor> parseServices(JsonNode servicesNode) throws DiscoveryException {
        if (!servicesNode.isArray()) {
            throw DiscoveryException.validation("services must be an array");
        }
        List<ServiceDescriptor> services = new ArrayList<>();
        int index = 0;
        for (JsonNode node : servicesNode) {
            String where = "services[" + index++ + "]";
            String name = requiredText(node, "name", null, where);
            JsonNode endpointsNode = field(node, "endpoints", null);
            if (endpointsNode == null || endpointsNode.isNull()) {
                throw DiscoveryException.validation(where + ".endpoints is required");
            }
            services.add(new ServiceDescriptor(
                name,
                text(node, "version", null),
                text(node, "description", null),
                text(node, "base_path", "basePath", "/"),
                parseEndpoints(endpointsNode, where + ".endpoints")
            ));
        }
        return services;
    }

    private List<Endpoint> parseEndpoints(JsonNode endpointsNode, String where) throws DiscoveryException {
        if (!endpointsNode.isArray()) {
            throw DiscoveryException.validation(where + " must be an array");
        }
        List<Endpoint> endpoints = new ArrayList<>();
        int index = 0;
        for (JsonNode node : endpointsNode) {
            String at = where + "[" + index++ + "]";
            if (!node.isObject()) {
                throw DiscoveryException.validation(at + " must be an object");
            }
            HttpMethod method = parseMethod(node, at);
            String path = requiredText(node, "path", null, at);
            endpoints.add(new Endpoint(
                method,
                path,
                text(node, "operation_id", "operationId", defaultOperationId(method, path)),
                text(node, "description", null),
                textList(field(node, "tags", null)),
                parseFields(field(node, "response_fields", "responseFields"), at + ".response_fields"),
                parseFields(field(node, "request_fields", "requestFields"), at + ".request_fields"),
                textList(field(node, "required_roles", "requiredRoles"))
            ));
        }
        return endpoints;
    }

    private HttpMethod parseMethod(JsonNode node, String where) throws DiscoveryException {
        String raw = requiredText(node, "method", null, where);
        HttpMethod method = HttpMethod.parse(raw);
        if (method == null) {
            throw DiscoveryException.validation(where + ".method '" + raw
                + "' is not one of GET, POST, PUT, PATCH, DELETE, HEAD, OPTIONS");
        }
        return method;
    }

    // ========================================================================
    // Fields
    // ========================================================================

    private List<FieldNode> parseFields(JsonNode fieldsNode, String where) throws DiscoveryException {
        if (fieldsNode == null || fieldsNode.isNull()) {
            return List.of();
        }
        List<FieldNode> fields = new ArrayList<>();
        if (fieldsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = fieldsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                fields.add(parseField(entry.getKey(), entry.getValue(), where + "." + entry.getKey()));
            }
        } else if (fieldsNode.isArray()) {
            int index = 0;
            for (JsonNode node : fieldsNode) {
                String at = where + "[" + index++ + "]";
                fields.add(parseField(requiredText(node, "name", null, at), node, at));
            }
        } else {
            throw DiscoveryException.validation(where + " must be an object or an array");
        }
        return fields;
    }

    private FieldNode parseField(String name, JsonNode node, String where) throws DiscoveryException {
        if (node == null || !node.isObject()) {
            throw DiscoveryException.validation(where + " must be an object");
        }
        FieldType type = parseType(node, where);
        String description = text(node, "description", null);
        boolean required = node.path("required").asBoolean(false);
        SensitivityFlags flags = new SensitivityFlags(
            node.path("sensitive").asBoolean(false),
            node.path("pii").asBoolean(false),
            node.path("phi").asBoolean(false),
            node.path("financial").asBoolean(false)
        );

        JsonNode children = field(node, "fields", null);
        JsonNode items = field(node, "items", null);
        boolean hasChildren = children != null && !children.isNull();
        boolean hasItems = items != null && !items.isNull();

        if (hasChildren && type != FieldType.OBJECT) {
            throw DiscoveryException.validation(where + ": fields can only be set for object type");
        }
        if (hasItems && type != FieldType.ARRAY) {
            throw DiscoveryException.validation(where + ": items can only be set for array type");
        }

        return switch (type) {
            case OBJECT -> new FieldNode.ObjectField(name, description, flags, required,
                parseFields(children, where + ".fields"));
            case ARRAY -> new FieldNode.ArrayField(name, description, flags, required,
                hasItems ? parseField(name, items, where + ".items") : null);
            default -> new FieldNode.ScalarField(name, type, description, flags, required,
                text(node, "format", null));
        };
    }

    private FieldType parseType(JsonNode node, String where) throws DiscoveryException {
        String raw = requiredText(node, "type", null, where);
        try {
            return FieldType.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw DiscoveryException.validation(where + ".type '" + raw + "' is not a supported field type");
        }
    }

    // ========================================================================
    // JSON helpers
    // ========================================================================

    private static JsonNode field(JsonNode node, String snake, String camel) {
        JsonNode value = node.get(snake);
        if ((value == null || value.isNull()) && camel != null) {
            value = node.get(camel);
        }
        return value;
    }

    private static String text(JsonNode node, String key, String defaultValue) {
        return text(node, key, null, defaultValue);
    }

    private static String text(JsonNode node, String snake, String camel, String defaultValue) {
        JsonNode value = field(node, snake, camel);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return defaultValue;
        }
        String text = value.asText();
        return text.isBlank() ? defaultValue : text;
    }

    private static String requiredText(JsonNode node, String snake, String camel) throws DiscoveryException {
        return requiredText(node, snake, camel, null);
    }

    private static String requiredText(JsonNode node, String snake, String camel, String where)
            throws DiscoveryException {
        String value = text(node, snake, camel, null);
        if (value == null) {
            String prefix = where != null ? where + "." : "";
            throw DiscoveryException.validation("Missing required field: " + prefix + snake);
        }
        return value;
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    private static String defaultOperationId(HttpMethod method, String path) {
        String normalized = path.replaceAll("[{}]", "").replaceAll("[^A-Za-z0-9]+", "_");
        normalized = normalized.replaceAll("^_+|_+$", "");
        return method.name().toLowerCase(Locale.ROOT) + (normalized.isEmpty() ? "" : "_" + normalized);
    }
}
