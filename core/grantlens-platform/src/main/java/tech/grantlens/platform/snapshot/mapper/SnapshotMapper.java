package tech.grantlens.platform.snapshot.mapper;

import tech.grantlens.platform.snapshot.Snapshot;
import tech.grantlens.platform.snapshot.entity.SnapshotEntity;

import java.time.Instant;

/**
 * Mapper for converting between Snapshot domain model and JPA entity.
 * The raw JSON column is written separately and never copied into the domain object.
 */
public final class SnapshotMapper {

    private SnapshotMapper() {
    }

    public static Snapshot toDomain(SnapshotEntity entity) {
        if (entity == null) {
            return null;
        }

        Snapshot domain = new Snapshot();
        domain.id = entity.id;
        domain.clusterId = entity.clusterId;
        domain.status = entity.status;
        domain.createdAt = entity.createdAt;
        domain.populatedAt = entity.populatedAt;
        domain.completedAt = entity.completedAt;
        domain.error = entity.error;
        domain.userCount = entity.userCount;
        domain.roleCount = entity.roleCount;
        domain.grantCount = entity.grantCount;
        return domain;
    }

    public static SnapshotEntity toEntity(Snapshot domain) {
        if (domain == null) {
            return null;
        }

        SnapshotEntity entity = new SnapshotEntity();
        entity.id = domain.id;
        updateEntity(entity, domain);
        entity.createdAt = domain.createdAt != null ? domain.createdAt : Instant.now();
        return entity;
    }

    /**
     * Copy lifecycle fields onto a managed entity, leaving id, creation time and raw JSON alone.
     */
    public static void updateEntity(SnapshotEntity entity, Snapshot domain) {
        entity.clusterId = domain.clusterId;
        entity.status = domain.status;
        entity.populatedAt = domain.populatedAt;
        entity.completedAt = domain.completedAt;
        entity.error = domain.error;
        entity.userCount = domain.userCount;
        entity.roleCount = domain.roleCount;
        entity.grantCount = domain.grantCount;
    }
}
