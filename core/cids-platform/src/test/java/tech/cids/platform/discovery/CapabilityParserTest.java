package tech.cids.platform.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.cids.platform.discovery.model.CapabilityDescriptor;
import tech.cids.platform.discovery.model.Endpoint;
import tech.cids.platform.discovery.model.FieldNode;
import tech.cids.platform.discovery.model.HttpMethod;

import static org.assertj.core.api.Assertions.*;

class CapabilityParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CapabilityParser parser = new CapabilityParser();

    @Test
    @DisplayName("parse should accept camelCase and snake_case keys alike")
    void parse_shouldAcceptBothKeyStyles() throws Exception {
        CapabilityDescriptor snake = parser.parse(json("""
            {"app_id": "hr", "app_name": "HR", "endpoints": [
              {"method": "get", "path": "/employees", "response_fields": {"name": {"type": "string"}},
               "required_roles": ["viewer"], "tags": ["people"]}
            ]}
            """));
        CapabilityDescriptor camel = parser.parse(json("""
            {"appId": "hr", "appName": "HR", "endpoints": [
              {"method": "GET", "path": "/employees", "responseFields": {"name": {"type": "string"}},
               "requiredRoles": ["viewer"], "tags": ["people"]}
            ]}
            """));

        assertThat(camel).isEqualTo(snake);
        Endpoint endpoint = snake.endpoints().get(0);
        assertThat(endpoint.method()).isEqualTo(HttpMethod.GET);
        assertThat(endpoint.operationId()).isEqualTo("get_employees");
        assertThat(endpoint.requiredRoles()).containsExactly("viewer");
        assertThat(snake.version()).isEqualTo(CapabilityDescriptor.CURRENT_VERSION);
    }

    @Test
    @DisplayName("parse should build object and array field variants")
    void parse_shouldBuildFieldVariants() throws Exception {
        CapabilityDescriptor descriptor = parser.parse(json("""
            {"app_id": "hr", "app_name": "HR", "endpoints": [
              {"method": "GET", "path": "/employees", "response_fields": {
                "address": {"type": "object", "fields": {"city": {"type": "string"}}},
                "skills": {"type": "array", "items": {"type": "string"}},
                "hired": {"type": "date"}
              }}
            ]}
            """));

        var fields = descriptor.endpoints().get(0).responseFields();
        assertThat(fields.get(0)).isInstanceOf(FieldNode.ObjectField.class);
        assertThat(((FieldNode.ObjectField) fields.get(0)).fields()).extracting(FieldNode::name).containsExactly("city");
        assertThat(fields.get(1)).isInstanceOf(FieldNode.ArrayField.class);
        assertThat(((FieldNode.ArrayField) fields.get(1)).items()).isInstanceOf(FieldNode.ScalarField.class);
        assertThat(fields.get(2)).isInstanceOf(FieldNode.ScalarField.class);
    }

    // ========================================
    // VALIDATION
    // ========================================

    @Test
    @DisplayName("parse should reject version 1.0 with an upgrade message")
    void parse_shouldRejectLegacyVersion() {
        assertValidationError("""
            {"app_id": "hr", "app_name": "HR", "version": "1.0", "endpoints": []}
            """, "upgrade required");
    }

    @Test
    @DisplayName("parse should require app id and app name")
    void parse_shouldRequireIdentity() {
        assertValidationError("""
            {"app_name": "HR", "endpoints": []}
            """, "app_id");
        assertValidationError("""
            {"app_id": "hr", "endpoints": []}
            """, "app_name");
    }

    @Test
    @DisplayName("parse should require exactly one of endpoints and services")
    void parse_shouldRequireExactlyOneOfEndpointsAndServices() {
        assertValidationError("""
            {"app_id": "hr", "app_name": "HR"}
            """, "either endpoints or services");
        assertValidationError("""
            {"app_id": "hr", "app_name": "HR", "endpoints": [], "services": []}
            """, "both endpoints and services");
    }

    @Test
    @DisplayName("parse should reject unsupported methods and missing paths")
    void parse_shouldRejectBadEndpoints() {
        assertValidationError("""
            {"app_id": "hr", "app_name": "HR", "endpoints": [{"method": "TRACE", "path": "/x"}]}
            """, "TRACE");
        assertValidationError("""
            {"app_id": "hr", "app_name": "HR", "endpoints": [{"method": "GET"}]}
            """, "path");
    }

    @Test
    @DisplayName("parse should reject fields on non-object types and items on non-array types")
    void parse_shouldRejectMismatchedChildren() {
        assertValidationError("""
            {"app_id": "hr", "app_name": "HR", "endpoints": [{"method": "GET", "path": "/x",
              "response_fields": {"name": {"type": "string", "fields": {"a": {"type": "string"}}}}}]}
            """, "fields can only be set for object type");
        assertValidationError("""
            {"app_id": "hr", "app_name": "HR", "endpoints": [{"method": "GET", "path": "/x",
              "response_fields": {"tags": {"type": "object", "items": {"type": "string"}}}}]}
            """, "items can only be set for array type");
    }

    @Test
    @DisplayName("parse should reject unknown field types")
    void parse_shouldRejectUnknownFieldType() {
        assertValidationError("""
            {"app_id": "hr", "app_name": "HR", "endpoints": [{"method": "GET", "path": "/x",
              "response_fields": {"blob": {"type": "binary"}}}]}
            """, "binary");
    }

    // ========================================
    // LEGACY
    // ========================================

    @Test
    @DisplayName("parseLegacy should accept the v1 endpoint list and fall back to registered identity")
    void parseLegacy_shouldAcceptV1Shape() throws Exception {
        CapabilityDescriptor descriptor = parser.parseLegacy(json("""
            {"endpoints": [{"method": "GET", "path": "/api/reports", "description": "Reports",
              "required_roles": ["analyst"]}]}
            """), "reports", "Reports");

        assertThat(descriptor.appId()).isEqualTo("reports");
        assertThat(descriptor.appName()).isEqualTo("Reports");
        assertThat(descriptor.version()).isEqualTo("1.0");
        assertThat(descriptor.endpoints()).singleElement()
            .satisfies(endpoint -> {
                assertThat(endpoint.responseFields()).isEmpty();
                assertThat(endpoint.requiredRoles()).containsExactly("analyst");
            });
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private void assertValidationError(String document, String messageFragment) {
        assertThatThrownBy(() -> parser.parse(json(document)))
            .isInstanceOf(DiscoveryException.class)
            .hasMessageContaining(messageFragment)
            .extracting(e -> ((DiscoveryException) e).getErrorType())
            .isEqualTo(DiscoveryErrorType.VALIDATION_ERROR);
    }
}
