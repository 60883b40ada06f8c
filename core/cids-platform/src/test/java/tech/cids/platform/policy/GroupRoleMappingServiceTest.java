package tech.cids.platform.policy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.cids.platform.common.Result;
import tech.cids.platform.common.errors.UseCaseError;
import tech.cids.platform.permission.PermissionRegistry;
import tech.cids.platform.role.Role;
import tech.cids.platform.support.DirectUnitOfWork;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GroupRoleMappingServiceTest {

    @Mock
    GroupRoleMappingRepository mappingRepository;

    @Mock
    PermissionRegistry permissionRegistry;

    private GroupRoleMappingService service;

    @BeforeEach
    void setUp() {
        service = new GroupRoleMappingService();
        service.mappingRepository = mappingRepository;
        service.permissionRegistry = permissionRegistry;
        service.unitOfWork = new DirectUnitOfWork();
    }

    @Test
    @DisplayName("mapGroup should persist a new mapping for an existing role")
    void mapGroup_shouldPersist_whenRoleExists() {
        // Arrange
        when(permissionRegistry.getRole("hr", "viewer")).thenReturn(Optional.of(new Role("rol_1", "hr", "viewer")));
        when(mappingRepository.findMapping("hr-team", "hr", "viewer")).thenReturn(Optional.empty());

        // Act
        Result<GroupRoleMapping> result = service.mapGroup("hr-team", "hr", "viewer");

        // Assert
        ArgumentCaptor<GroupRoleMapping> captor = ArgumentCaptor.forClass(GroupRoleMapping.class);
        verify(mappingRepository).persist(captor.capture());
        assertThat(result.valueOrNull()).isSameAs(captor.getValue());
        assertThat(captor.getValue().id).startsWith("grm_");
        assertThat(captor.getValue().groupName).isEqualTo("hr-team");
    }

    @Test
    @DisplayName("mapGroup should return the stored mapping when the pair is already mapped")
    void mapGroup_shouldBeIdempotent() {
        GroupRoleMapping existing = new GroupRoleMapping("grm_1", "hr-team", "hr", "viewer");
        when(permissionRegistry.getRole("hr", "viewer")).thenReturn(Optional.of(new Role("rol_1", "hr", "viewer")));
        when(mappingRepository.findMapping("hr-team", "hr", "viewer")).thenReturn(Optional.of(existing));

        Result<GroupRoleMapping> result = service.mapGroup("hr-team", "hr", "viewer");

        assertThat(result.valueOrNull()).isSameAs(existing);
        verify(mappingRepository, never()).persist(any());
    }

    @Test
    @DisplayName("mapGroup should fail when the role does not exist")
    void mapGroup_shouldFail_whenRoleMissing() {
        when(permissionRegistry.getRole("hr", "ghost")).thenReturn(Optional.empty());

        Result<GroupRoleMapping> result = service.mapGroup("hr-team", "hr", "ghost");

        assertThat(result.errorOrNull()).isInstanceOf(UseCaseError.NotFoundError.class);
        assertThat(result.errorOrNull().code()).isEqualTo("ROLE_NOT_FOUND");
        verifyNoInteractions(mappingRepository);
    }

    @Test
    @DisplayName("mapGroup should require a group name")
    void mapGroup_shouldFail_whenGroupBlank() {
        Result<GroupRoleMapping> result = service.mapGroup(" ", "hr", "viewer");

        assertThat(result.errorOrNull().code()).isEqualTo("GROUP_NAME_REQUIRED");
        verifyNoInteractions(permissionRegistry, mappingRepository);
    }

    @Test
    @DisplayName("unmapGroup should report a missing mapping")
    void unmapGroup_shouldFail_whenNotMapped() {
        when(mappingRepository.deleteMapping("hr-team", "hr", "viewer")).thenReturn(false);

        Result<Void> result = service.unmapGroup("hr-team", "hr", "viewer");

        assertThat(result.errorOrNull().code()).isEqualTo("MAPPING_NOT_FOUND");
    }

    @Test
    @DisplayName("deleteRole should remove the role's mappings once the role is gone")
    void deleteRole_shouldRemoveMappings_whenRoleDeleted() {
        Role role = new Role("rol_1", "hr", "viewer");
        when(permissionRegistry.deleteRole("hr", "viewer")).thenReturn(Result.success(role));
        when(mappingRepository.deleteByAppIdAndRoleName("hr", "viewer")).thenReturn(2L);

        Result<Role> result = service.deleteRole("hr", "viewer");

        assertThat(result.valueOrNull()).isSameAs(role);
        verify(mappingRepository).deleteByAppIdAndRoleName("hr", "viewer");
    }

    @Test
    @DisplayName("deleteRole should keep mappings when the registry refuses the delete")
    void deleteRole_shouldKeepMappings_whenRoleMissing() {
        when(permissionRegistry.deleteRole("hr", "ghost")).thenReturn(Result.failure(
            UseCaseError.notFound("ROLE_NOT_FOUND", "Role ghost not found", Map.of("roleName", "ghost"))));

        Result<Role> result = service.deleteRole("hr", "ghost");

        assertThat(result.isFailure()).isTrue();
        verifyNoInteractions(mappingRepository);
    }
}
