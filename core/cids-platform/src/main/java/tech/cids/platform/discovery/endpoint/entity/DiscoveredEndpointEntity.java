package tech.cids.platform.discovery.endpoint.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for discovered_endpoints table.
 */
@Entity
@Table(name = "discovered_endpoints", indexes = @Index(name = "idx_discovered_endpoints_app", columnList = "app_id"))
public class DiscoveredEndpointEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "app_id", nullable = false, length = 100)
    public String appId;

    @Column(name = "service_name", length = 100)
    public String serviceName;

    @Column(name = "method", nullable = false, length = 10)
    public String method;

    @Column(name = "path", nullable = false, length = 1024)
    public String path;

    @Column(name = "operation_id")
    public String operationId;

    @Column(name = "description", columnDefinition = "TEXT")
    public String description;

    @Column(name = "tags", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] tags;

    @Column(name = "required_roles", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] requiredRoles;

    @Column(name = "discovered", nullable = false)
    public boolean discovered;

    @Column(name = "discovered_at", nullable = false)
    public Instant discoveredAt;

    public DiscoveredEndpointEntity() {
    }
}
