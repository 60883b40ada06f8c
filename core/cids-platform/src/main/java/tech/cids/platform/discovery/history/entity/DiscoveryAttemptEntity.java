package tech.cids.platform.discovery.history.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import tech.cids.platform.discovery.DiscoveryErrorType;

import java.time.Instant;

/**
 * JPA entity for discovery_attempts table.
 */
@Entity
@Table(name = "discovery_attempts", indexes = @Index(name = "idx_discovery_attempts_app_time", columnList = "app_id, attempted_at"))
public class DiscoveryAttemptEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "app_id", nullable = false, length = 100)
    public String appId;

    @Column(name = "discovery_run_id", length = 17)
    public String discoveryRunId;

    @Column(name = "attempted_at", nullable = false)
    public Instant timestamp;

    @Column(name = "success", nullable = false)
    public boolean success;

    @Column(name = "error_type", length = 30)
    @Enumerated(EnumType.STRING)
    public DiscoveryErrorType errorType;

    @Column(name = "error_message", columnDefinition = "TEXT")
    public String errorMessage;

    @Column(name = "response_time_ms", nullable = false)
    public long responseTimeMs;

    @Column(name = "endpoints_found", nullable = false)
    public int endpointsFound;

    @Column(name = "permissions_generated", nullable = false)
    public int permissionsGenerated;

    @Column(name = "attempt_number", nullable = false)
    public int attemptNumber;

    public DiscoveryAttemptEntity() {
    }
}
