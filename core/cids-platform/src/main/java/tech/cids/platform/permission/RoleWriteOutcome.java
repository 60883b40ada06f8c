package tech.cids.platform.permission;

import tech.cids.platform.role.Role;

import java.util.List;
import java.util.Set;

/**
 * Result of a role write: the stored role plus what happened to each requested key.
 *
 * @param validAllowed allowed keys as stored, wildcard expansions included
 * @param validDenied denied keys as stored, wildcard expansions included
 * @param rejected well-formed keys dropped because nothing in the catalog matched them
 */
public record RoleWriteOutcome(
    Role role,
    Set<String> validAllowed,
    Set<String> validDenied,
    List<String> rejected,
    boolean created
) {
}
