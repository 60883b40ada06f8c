package tech.cids.platform.permission;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.cids.platform.discovery.CapabilityParser;
import tech.cids.platform.discovery.model.CapabilityDescriptor;
import tech.cids.platform.discovery.model.HttpMethod;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class PermissionExpanderTest {

    private static final Instant DISCOVERED_AT = Instant.parse("2026-01-15T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CapabilityParser parser = new CapabilityParser();
    private final PermissionExpander expander = new PermissionExpander();

    @Test
    @DisplayName("expand should emit the field key and the endpoint wildcard for the HR example")
    void expand_shouldEmitFieldAndWildcard_whenHrDescriptor() throws Exception {
        // Arrange
        CapabilityDescriptor descriptor = parse("""
            {"appId": "hr", "app_name": "HR", "endpoints": [
              {"method": "GET", "path": "/employees/{id}", "operation_id": "get_employee", "description": "x",
               "response_fields": {"ssn": {"type": "string", "pii": true}}}
            ]}
            """);

        // Act
        Map<String, PermissionMetadata> byKey = byKey(expander.expand("hr", descriptor, "run-1", DISCOVERED_AT));

        // Assert
        assertThat(byKey).containsOnlyKeys("hr.employees.read.ssn", "hr.employees.read.*");
        PermissionMetadata ssn = byKey.get("hr.employees.read.ssn");
        assertThat(ssn.pii()).isTrue();
        assertThat(ssn.sensitive()).isFalse();
        assertThat(ssn.category()).isEqualTo(PermissionCategory.PII);
        assertThat(ssn.sourceEndpointId()).isEqualTo("get_employee");
        assertThat(ssn.discoveryRunId()).isEqualTo("run-1");

        PermissionMetadata wildcard = byKey.get("hr.employees.read.*");
        assertThat(wildcard.isWildcard()).isTrue();
        assertThat(wildcard.description()).isEqualTo("Read all fields for employees");
    }

    @Test
    @DisplayName("expand should give identical key sets when run twice on the same descriptor")
    void expand_shouldBeIdempotent() throws Exception {
        CapabilityDescriptor descriptor = parse(richDescriptor());

        List<String> first = keys(expander.expand("hr", descriptor, "run-1", DISCOVERED_AT));
        List<String> second = keys(expander.expand("hr", descriptor, "run-2", DISCOVERED_AT.plusSeconds(60)));

        assertThat(first).isEqualTo(second);
        assertThat(first).isSorted();
    }

    @Test
    @DisplayName("expand should walk nested objects and arrays of objects")
    void expand_shouldWalkNestedObjectsAndArrays() throws Exception {
        List<String> keys = keys(expander.expand("hr", parse(richDescriptor()), "run-1", DISCOVERED_AT));

        assertThat(keys).contains(
            "hr.employees.read.address",
            "hr.employees.read.address.city",
            "hr.employees.read.address.geo",
            "hr.employees.read.address.geo.lat",
            "hr.employees.read.dependents",
            "hr.employees.read.dependents[].name",
            "hr.employees.read.dependents[].medical_notes");
    }

    @Test
    @DisplayName("expand should emit write keys for request bodies and action wildcards per method")
    void expand_shouldEmitWriteKeysAndActionWildcards() throws Exception {
        List<String> keys = keys(expander.expand("hr", parse(richDescriptor()), "run-1", DISCOVERED_AT));

        assertThat(keys).contains(
            "hr.employees.write.name",
            "hr.employees.write.salary",
            "hr.employees.create.*",
            "hr.employees.update.*",
            "hr.employees.delete.*");
        assertThat(keys).doesNotContain("hr.employees.write.*");
    }

    @Test
    @DisplayName("expand should carry each field's own sensitivity flags")
    void expand_shouldCarryFieldFlags() throws Exception {
        Map<String, PermissionMetadata> byKey = byKey(expander.expand("hr", parse(richDescriptor()), "run-1", DISCOVERED_AT));

        assertThat(byKey.get("hr.employees.write.salary").financial()).isTrue();
        assertThat(byKey.get("hr.employees.read.dependents[].medical_notes").phi()).isTrue();
        assertThat(byKey.get("hr.employees.read.address.city").isClassified()).isFalse();
    }

    @Test
    @DisplayName("expand should prefix resources with the service name in multi-service descriptors")
    void expand_shouldPrefixServiceName_whenMultiService() throws Exception {
        CapabilityDescriptor descriptor = parse("""
            {"app_id": "erp", "app_name": "ERP", "services": [
              {"name": "billing", "endpoints": [
                {"method": "GET", "path": "/api/invoices", "response_fields": {"total": {"type": "number", "financial": true}}}
              ]},
              {"name": "stock", "endpoints": [
                {"method": "DELETE", "path": "/api/items/{id}"}
              ]}
            ]}
            """);

        List<String> keys = keys(expander.expand("erp", descriptor, "run-1", DISCOVERED_AT));

        assertThat(keys).containsExactly(
            "erp.billing_invoices.read.*",
            "erp.billing_invoices.read.total",
            "erp.stock_items.delete.*");
    }

    // ========================================
    // RESOURCE AND ACTION NAMING
    // ========================================

    @Test
    @DisplayName("resourceFromPath should drop the api prefix and parameters")
    void resourceFromPath_shouldDropApiPrefixAndParameters() {
        assertThat(PermissionExpander.resourceFromPath("/api/employees/{id}/payslips")).isEqualTo("employees_payslips");
        assertThat(PermissionExpander.resourceFromPath("/employees/{id}")).isEqualTo("employees");
        assertThat(PermissionExpander.resourceFromPath("/api")).isEqualTo("root");
        assertThat(PermissionExpander.resourceFromPath("/")).isEqualTo("root");
    }

    @Test
    @DisplayName("actionFromMethod should map POST on an item to update")
    void actionFromMethod_shouldDistinguishCollectionPost() {
        assertThat(PermissionExpander.actionFromMethod(HttpMethod.POST, true)).isEqualTo("create");
        assertThat(PermissionExpander.actionFromMethod(HttpMethod.POST, false)).isEqualTo("update");
        assertThat(PermissionExpander.actionFromMethod(HttpMethod.PATCH, false)).isEqualTo("update");
        assertThat(PermissionExpander.actionFromMethod(HttpMethod.HEAD, true)).isEqualTo("check");
        assertThat(PermissionExpander.actionFromMethod(HttpMethod.OPTIONS, true)).isEqualTo("options");
    }

    // ========================================
    // HELPERS
    // ========================================

    private CapabilityDescriptor parse(String json) throws Exception {
        return parser.parse(objectMapper.readTree(json));
    }

    private static List<String> keys(List<PermissionMetadata> permissions) {
        return permissions.stream().map(PermissionMetadata::permissionKey).toList();
    }

    private static Map<String, PermissionMetadata> byKey(List<PermissionMetadata> permissions) {
        return permissions.stream().collect(Collectors.toMap(PermissionMetadata::permissionKey, Function.identity()));
    }

    private static String richDescriptor() {
        return """
            {"app_id": "hr", "app_name": "HR", "version": "2.0", "endpoints": [
              {"method": "GET", "path": "/api/employees/{id}", "operation_id": "get_employee",
               "response_fields": {
                 "name": {"type": "string"},
                 "address": {"type": "object", "fields": {
                   "city": {"type": "string"},
                   "geo": {"type": "object", "fields": {"lat": {"type": "number"}}}
                 }},
                 "dependents": {"type": "array", "items": {"type": "object", "fields": {
                   "name": {"type": "string", "pii": true},
                   "medical_notes": {"type": "string", "phi": true}
                 }}}
               }},
              {"method": "POST", "path": "/api/employees",
               "request_fields": [
                 {"name": "name", "type": "string"},
                 {"name": "salary", "type": "number", "financial": true}
               ]},
              {"method": "PUT", "path": "/api/employees/{id}",
               "request_fields": {"name": {"type": "string"}}},
              {"method": "DELETE", "path": "/api/employees/{id}"}
            ]}
            """;
    }
}
