package tech.grantlens.platform.snapshot.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import tech.grantlens.platform.snapshot.SnapshotStatus;

import java.time.Instant;

/**
 * JPA entity for rbac_snapshots table.
 */
@Entity
@Table(name = "rbac_snapshots", indexes = {
    @Index(name = "idx_rbac_snapshots_cluster", columnList = "cluster_id, created_at")
})
public class SnapshotEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "cluster_id", nullable = false, length = 100)
    public String clusterId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    public SnapshotStatus status;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "populated_at")
    public Instant populatedAt;

    @Column(name = "completed_at")
    public Instant completedAt;

    @Column(name = "error", columnDefinition = "text")
    public String error;

    @Column(name = "user_count")
    public Integer userCount;

    @Column(name = "role_count")
    public Integer roleCount;

    @Column(name = "grant_count")
    public Integer grantCount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_json", columnDefinition = "jsonb")
    public String rawJson;

    public SnapshotEntity() {
    }
}
