package tech.cids.platform.application.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for registered_applications table.
 */
@Entity
@Table(name = "registered_applications",
    uniqueConstraints = @UniqueConstraint(name = "uq_registered_applications_app_id", columnNames = "app_id"),
    indexes = @Index(name = "idx_registered_applications_discovery", columnList = "allow_discovery, active"))
public class RegisteredApplicationEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "app_id", nullable = false, length = 100)
    public String appId;

    @Column(name = "name", nullable = false)
    public String name;

    @Column(name = "description", columnDefinition = "TEXT")
    public String description;

    @Column(name = "discovery_url", length = 2048)
    public String discoveryUrl;

    @Column(name = "allow_discovery", nullable = false)
    public boolean allowDiscovery;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "discovery_status", length = 30)
    public String discoveryStatus;

    @Column(name = "last_discovery_at")
    public Instant lastDiscoveryAt;

    @Column(name = "discovery_version", length = 20)
    public String discoveryVersion;

    @Column(name = "discovery_run_count", nullable = false)
    public int discoveryRunCount;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public RegisteredApplicationEntity() {
    }
}
