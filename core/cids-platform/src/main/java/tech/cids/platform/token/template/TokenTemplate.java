package tech.cids.platform.token.template;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A claim whitelist applied to access tokens of users in the listed groups.
 *
 * <p>A template without groups is a default template; it applies when no group template
 * matches the user.
 */
public class TokenTemplate {

    public String id;

    /**
     * Unique business key.
     */
    public String name;

    public String description;

    public List<String> groups = new ArrayList<>();

    /**
     * Higher wins when several templates match.
     */
    public int priority = 0;

    public boolean enabled = true;

    public List<TemplateClaim> claims = new ArrayList<>();

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public TokenTemplate() {
    }

    public TokenTemplate(String name, List<String> groups, int priority, List<TemplateClaim> claims) {
        this.name = name;
        this.groups = groups != null ? new ArrayList<>(groups) : new ArrayList<>();
        this.priority = priority;
        this.claims = claims != null ? new ArrayList<>(claims) : new ArrayList<>();
    }

    public boolean isDefault() {
        return groups == null || groups.isEmpty();
    }
}
