package tech.cids.platform.token.template;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.cids.platform.common.Result;
import tech.cids.platform.common.errors.UseCaseError;
import tech.cids.platform.support.DirectUnitOfWork;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TokenTemplateServiceTest {

    @Mock
    TokenTemplateRepository templateRepository;

    private TokenTemplateService service;

    @BeforeEach
    void setUp() {
        service = new TokenTemplateService();
        service.templateRepository = templateRepository;
        service.unitOfWork = new DirectUnitOfWork();
    }

    // ========================================
    // SELECTION
    // ========================================

    @Test
    @DisplayName("findMatchingTemplate should prefer the highest-priority group template")
    void findMatchingTemplate_shouldPickHighestPriorityGroupTemplate() {
        TokenTemplate low = template("contractors", List.of("contractors"), 1);
        TokenTemplate high = template("finance", List.of("finance", "contractors"), 10);
        TokenTemplate fallback = template("default", List.of(), 100);
        when(templateRepository.findEnabled()).thenReturn(List.of(low, high, fallback));

        assertThat(service.findMatchingTemplate(List.of("contractors"))).containsSame(high);
    }

    @Test
    @DisplayName("findMatchingTemplate should break a priority tie by template name, whatever the store order")
    void findMatchingTemplate_shouldPickFirstName_whenPrioritiesTie() {
        TokenTemplate payroll = template("payroll", List.of("finance"), 5);
        TokenTemplate audit = template("audit", List.of("finance"), 5);
        TokenTemplate defaultB = template("default-b", List.of(), 0);
        TokenTemplate defaultA = template("default-a", List.of(), 0);

        when(templateRepository.findEnabled()).thenReturn(List.of(payroll, audit, defaultB, defaultA));
        Optional<TokenTemplate> forward = service.findMatchingTemplate(List.of("finance"));
        Optional<TokenTemplate> forwardDefault = service.findMatchingTemplate(List.of("engineering"));

        when(templateRepository.findEnabled()).thenReturn(List.of(defaultA, defaultB, audit, payroll));
        Optional<TokenTemplate> reversed = service.findMatchingTemplate(List.of("finance"));
        Optional<TokenTemplate> reversedDefault = service.findMatchingTemplate(List.of("engineering"));

        assertThat(forward).containsSame(audit);
        assertThat(reversed).containsSame(audit);
        assertThat(forwardDefault).containsSame(defaultA);
        assertThat(reversedDefault).containsSame(defaultA);
    }

    @Test
    @DisplayName("findMatchingTemplate should fall back to the default template when no group matches")
    void findMatchingTemplate_shouldFallBackToDefault() {
        TokenTemplate groupTemplate = template("finance", List.of("finance"), 10);
        TokenTemplate fallback = template("default", List.of(), 0);
        when(templateRepository.findEnabled()).thenReturn(List.of(groupTemplate, fallback));

        assertThat(service.findMatchingTemplate(List.of("engineering"))).containsSame(fallback);
        assertThat(service.findMatchingTemplate(null)).containsSame(fallback);
    }

    @Test
    @DisplayName("apply should pass claims through untouched when no template matches")
    void apply_shouldPassThrough_whenNoTemplate() {
        when(templateRepository.findEnabled()).thenReturn(List.of());
        Map<String, Object> claims = composed();

        Map<String, Object> result = service.apply(claims, List.of("engineering"));

        assertThat(result).isEqualTo(claims).isNotSameAs(claims);
    }

    // ========================================
    // APPLICATION
    // ========================================

    @Test
    @DisplayName("apply should keep listed claims, fill defaults and preserve protected claims")
    void apply_shouldFilterClaims() {
        TokenTemplate slim = template("slim", List.of("contractors"), 5);
        slim.claims = List.of(
            TemplateClaim.of("roles"),
            new TemplateClaim("permissions", false, null, "object"),
            new TemplateClaim("tenant", true, "acme", "string"),
            new TemplateClaim("entitlements", true, null, "array"),
            new TemplateClaim("metadata", true, null, "object"));
        when(templateRepository.findEnabled()).thenReturn(List.of(slim));

        Map<String, Object> result = service.apply(composed(), List.of("contractors"));

        assertThat(result)
            .containsEntry("roles", Map.of("hr", List.of("viewer")))
            .containsEntry("tenant", "acme")
            .containsEntry("entitlements", List.of())
            .containsEntry("metadata", Map.of())
            .containsEntry("sub", "u-1")
            .containsEntry("email", "ada@example.com")
            .containsEntry("token_type", "access")
            .containsEntry(TokenTemplateService.CLAIM_TEMPLATE_APPLIED, "slim")
            .containsEntry(TokenTemplateService.CLAIM_TEMPLATE_PRIORITY, 5)
            .doesNotContainKeys("permissions", "rls_filters", "groups");
    }

    // ========================================
    // ADMINISTRATION
    // ========================================

    @Test
    @DisplayName("saveTemplate should list every validation problem")
    void saveTemplate_shouldRejectInvalidTemplate() {
        TokenTemplate invalid = template(" ", List.of("ok", " "), 0);
        invalid.claims = List.of(TemplateClaim.of("roles"), TemplateClaim.of("roles"),
            new TemplateClaim("x", true, null, "date"));

        Result<TokenTemplate> result = service.saveTemplate(invalid);

        assertThat(result.errorOrNull()).isInstanceOf(UseCaseError.ValidationError.class);
        assertThat(result.errorOrNull().code()).isEqualTo("INVALID_TOKEN_TEMPLATE");
        @SuppressWarnings("unchecked")
        List<String> problems = (List<String>) result.errorOrNull().details().get("problems");
        assertThat(problems).hasSize(4);
        verifyNoInteractions(templateRepository);
    }

    @Test
    @DisplayName("saveTemplate should create a new template with an ID")
    void saveTemplate_shouldPersistNew() {
        TokenTemplate template = template("slim", List.of("contractors"), 5);
        when(templateRepository.findByName("slim")).thenReturn(Optional.empty());

        TokenTemplate saved = service.saveTemplate(template).valueOrNull();

        assertThat(saved.id).startsWith("ttp_");
        verify(templateRepository).persist(template);
    }

    @Test
    @DisplayName("saveTemplate should replace an existing template with the same name")
    void saveTemplate_shouldUpdateExisting() {
        TokenTemplate stored = template("slim", List.of("contractors"), 5);
        stored.id = "ttp_existing";
        when(templateRepository.findByName("slim")).thenReturn(Optional.of(stored));
        TokenTemplate replacement = template("slim", List.of("vendors"), 7);

        TokenTemplate saved = service.saveTemplate(replacement).valueOrNull();

        assertThat(saved).isSameAs(stored);
        assertThat(saved.groups).containsExactly("vendors");
        assertThat(saved.priority).isEqualTo(7);
        verify(templateRepository).update(stored);
        verify(templateRepository, never()).persist(any());
    }

    @Test
    @DisplayName("deleteTemplate should report an unknown template")
    void deleteTemplate_shouldFail_whenMissing() {
        when(templateRepository.deleteByName("ghost")).thenReturn(false);

        assertThat(service.deleteTemplate("ghost").errorOrNull().code()).isEqualTo("TEMPLATE_NOT_FOUND");
    }

    private static TokenTemplate template(String name, List<String> groups, int priority) {
        return new TokenTemplate(name, groups, priority, List.of());
    }

    private static Map<String, Object> composed() {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", "u-1");
        claims.put("email", "ada@example.com");
        claims.put("name", "Ada");
        claims.put("groups", List.of("contractors"));
        claims.put("roles", Map.of("hr", List.of("viewer")));
        claims.put("permissions", Map.of("hr", List.of("hr.employees.read.name")));
        claims.put("rls_filters", Map.of());
        claims.put("token_type", "access");
        claims.put("token_version", "2.0");
        return claims;
    }
}
