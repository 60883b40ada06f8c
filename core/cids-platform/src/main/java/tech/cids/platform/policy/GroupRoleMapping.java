package tech.cids.platform.policy;

import java.time.Instant;

/**
 * Grants a role in one application to every member of an identity-provider group.
 *
 * <p>Only groups listed here contribute roles at token issuance; group names are matched
 * exactly as the identity provider reports them.
 */
public class GroupRoleMapping {

    public String id;

    public String groupName;

    public String appId;

    public String roleName;

    public Instant createdAt = Instant.now();

    public GroupRoleMapping() {
    }

    public GroupRoleMapping(String id, String groupName, String appId, String roleName) {
        this.id = id;
        this.groupName = groupName;
        this.appId = appId;
        this.roleName = roleName;
    }
}
