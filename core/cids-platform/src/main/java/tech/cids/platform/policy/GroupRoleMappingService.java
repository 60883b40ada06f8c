package tech.cids.platform.policy;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.common.Result;
import tech.cids.platform.common.UnitOfWork;
import tech.cids.platform.common.errors.UseCaseError;
import tech.cids.platform.permission.PermissionRegistry;
import tech.cids.platform.role.Role;
import tech.cids.platform.shared.EntityType;
import tech.cids.platform.shared.TsidGenerator;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maintains the group to role table.
 */
@ApplicationScoped
public class GroupRoleMappingService {

    private static final Logger LOG = Logger.getLogger(GroupRoleMappingService.class);

    @Inject
    GroupRoleMappingRepository mappingRepository;

    @Inject
    PermissionRegistry permissionRegistry;

    @Inject
    UnitOfWork unitOfWork;

    /**
     * Grant the role to members of the group. Mapping an existing pair again returns the
     * stored mapping.
     */
    public Result<GroupRoleMapping> mapGroup(String groupName, String appId, String roleName) {
        if (groupName == null || groupName.isBlank()) {
            return Result.failure(UseCaseError.validation("GROUP_NAME_REQUIRED", "Group name is required"));
        }
        if (permissionRegistry.getRole(appId, roleName).isEmpty()) {
            return Result.failure(UseCaseError.notFound("ROLE_NOT_FOUND",
                "Role " + roleName + " does not exist for app " + appId,
                Map.of("appId", appId, "roleName", roleName)));
        }

        GroupRoleMapping mapping = unitOfWork.inTransaction(() -> {
            Optional<GroupRoleMapping> existing = mappingRepository.findMapping(groupName, appId, roleName);
            if (existing.isPresent()) {
                return existing.get();
            }
            GroupRoleMapping created = new GroupRoleMapping(TsidGenerator.generate(EntityType.GROUP_ROLE_MAPPING),
                groupName, appId, roleName);
            mappingRepository.persist(created);
            LOG.infof("Mapped group [%s] to role %s of app %s", groupName, roleName, appId);
            return created;
        });
        return Result.success(mapping);
    }

    public Result<Void> unmapGroup(String groupName, String appId, String roleName) {
        boolean removed = unitOfWork.inTransaction(() -> mappingRepository.deleteMapping(groupName, appId, roleName));
        if (!removed) {
            return Result.failure(UseCaseError.notFound("MAPPING_NOT_FOUND",
                "Group " + groupName + " is not mapped to role " + roleName + " of app " + appId,
                Map.of("groupName", groupName, "appId", appId, "roleName", roleName)));
        }
        LOG.infof("Unmapped group [%s] from role %s of app %s", groupName, roleName, appId);
        return Result.success(null);
    }

    /**
     * Delete the role from the registry, then every group mapping that pointed at it.
     */
    public Result<Role> deleteRole(String appId, String roleName) {
        Result<Role> deleted = permissionRegistry.deleteRole(appId, roleName);
        if (deleted.isSuccess()) {
            long removed = unitOfWork.inTransaction(() -> mappingRepository.deleteByAppIdAndRoleName(appId, roleName));
            if (removed > 0) {
                LOG.infof("Removed %d group mapping(s) to deleted role %s of app %s", removed, roleName, appId);
            }
        }
        return deleted;
    }

    public List<GroupRoleMapping> listMappings(String appId) {
        return mappingRepository.findByAppId(appId);
    }
}
