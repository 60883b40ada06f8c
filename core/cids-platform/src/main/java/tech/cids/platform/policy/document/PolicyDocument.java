package tech.cids.platform.policy.document;

import tech.cids.platform.policy.abac.AbacRule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A versioned policy: a role/permission matrix plus ABAC rules. At most one document is
 * active; its ABAC rules are consulted at token issuance.
 */
public class PolicyDocument {

    public String id;

    /**
     * Caller-chosen business key.
     */
    public String policyId;

    public String version;

    public String description;

    public List<RoleMatrixEntry> roleMatrix = new ArrayList<>();

    public List<AbacRule> abacRules = new ArrayList<>();

    public boolean active = false;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public PolicyDocument() {
    }

    public PolicyDocument(String policyId, List<RoleMatrixEntry> roleMatrix, List<AbacRule> abacRules) {
        this.policyId = policyId;
        this.roleMatrix = roleMatrix != null ? new ArrayList<>(roleMatrix) : new ArrayList<>();
        this.abacRules = abacRules != null ? new ArrayList<>(abacRules) : new ArrayList<>();
    }
}
