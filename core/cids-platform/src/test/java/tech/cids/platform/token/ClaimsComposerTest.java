package tech.cids.platform.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.cids.platform.policy.EffectiveGrant;
import tech.cids.platform.policy.PolicyResolver;
import tech.cids.platform.policy.abac.AbacRequest;
import tech.cids.platform.role.FilterClause;
import tech.cids.platform.role.FilterOperator;
import tech.cids.platform.token.template.TokenTemplateService;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClaimsComposerTest {

    @Mock
    PolicyResolver policyResolver;

    @Mock
    TokenTemplateService templateService;

    @InjectMocks
    ClaimsComposer composer;

    @Test
    @DisplayName("buildClaims should emit roles, permissions and row filters per application")
    void buildClaims_shouldComposeGrants() {
        // Arrange
        FilterClause clause = new FilterClause("department = 'HR'", FilterOperator.OR, 2);
        Map<String, EffectiveGrant> grants = new LinkedHashMap<>();
        grants.put("crm", grant("crm", List.of("reader"), List.of(), Map.of()));
        grants.put("hr", grant("hr", List.of("viewer"), List.of("hr.employees.read.ssn", "hr.employees.read.*"),
            Map.of("employees", Map.of("department", List.of(clause)))));
        when(policyResolver.resolve(any(AbacRequest.class), isNull())).thenReturn(grants);
        AuthenticatedUser user = AuthenticatedUser.of("u-1", "ada@example.com", "Ada", List.of("hr-team"));

        // Act
        Map<String, Object> claims = composer.buildClaims(user, null);

        // Assert
        assertThat(claims)
            .containsEntry("sub", "u-1")
            .containsEntry("email", "ada@example.com")
            .containsEntry("groups", List.of("hr-team"))
            .containsEntry("roles", Map.of("crm", List.of("reader"), "hr", List.of("viewer")))
            .containsEntry("permissions", Map.of("hr", List.of("hr.employees.read.*", "hr.employees.read.ssn")))
            .containsEntry("token_type", "access")
            .containsEntry("token_version", "2.0")
            .doesNotContainKeys("aud", "bound_ip", "bound_device");
        assertThat(claims.get("rls_filters")).isEqualTo(Map.of("hr", Map.of("employees", Map.of("department",
            List.of(Map.of("filter_expression", "department = 'HR'", "operator", "OR", "priority", 2))))));
    }

    @Test
    @DisplayName("buildClaims should carry audience and bindings when present")
    void buildClaims_shouldCarryAudienceAndBindings() {
        when(policyResolver.resolve(any(AbacRequest.class), eq("hr"))).thenReturn(Map.of());
        AuthenticatedUser user = new AuthenticatedUser("u-1", null, null, List.of(), "10.0.0.7", "device-1");

        Map<String, Object> claims = composer.buildClaims(user, "hr");

        assertThat(claims)
            .containsEntry("aud", List.of("hr"))
            .containsEntry("email", "")
            .containsEntry("name", "")
            .containsEntry("bound_ip", "10.0.0.7")
            .containsEntry("bound_device", "device-1")
            .containsEntry("roles", Map.of())
            .containsEntry("permissions", Map.of());
    }

    @Test
    @DisplayName("buildClaims should pass subject and groups to the resolver")
    void buildClaims_shouldBuildAbacRequestFromUser() {
        when(policyResolver.resolve(any(AbacRequest.class), isNull())).thenReturn(Map.of());

        composer.buildClaims(AuthenticatedUser.of("u-1", null, null, List.of("a", "b")), null);

        ArgumentCaptor<AbacRequest> captor = ArgumentCaptor.forClass(AbacRequest.class);
        verify(policyResolver).resolve(captor.capture(), isNull());
        assertThat(captor.getValue().subject()).isEqualTo("u-1");
        assertThat(captor.getValue().groups()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    @DisplayName("composeClaims should run the composed claims through the token template")
    void composeClaims_shouldApplyTemplate() {
        when(policyResolver.resolve(any(AbacRequest.class), isNull())).thenReturn(Map.of());
        Map<String, Object> templated = Map.of("sub", "u-1", "_template_applied", "slim");
        when(templateService.apply(anyMap(), eq(List.of("contractors")))).thenReturn(templated);

        Map<String, Object> claims = composer.composeClaims(
            AuthenticatedUser.of("u-1", null, null, List.of("contractors")), null);

        assertThat(claims).isSameAs(templated);
    }

    private static EffectiveGrant grant(String appId, List<String> roles, List<String> permissions,
                                        Map<String, Map<String, List<FilterClause>>> filters) {
        return new EffectiveGrant(appId, new TreeSet<>(roles), new TreeSet<>(permissions), filters);
    }
}
