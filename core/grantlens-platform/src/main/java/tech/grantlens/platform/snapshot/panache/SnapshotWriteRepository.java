package tech.grantlens.platform.snapshot.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.grantlens.platform.snapshot.Snapshot;
import tech.grantlens.platform.snapshot.entity.SnapshotEntity;
import tech.grantlens.platform.snapshot.mapper.SnapshotMapper;

/**
 * Write-side repository for Snapshot entities.
 */
@ApplicationScoped
public class SnapshotWriteRepository implements PanacheRepositoryBase<SnapshotEntity, String> {

    public void persistSnapshot(Snapshot snapshot) {
        persist(SnapshotMapper.toEntity(snapshot));
    }

    /**
     * Copy lifecycle fields onto the stored row.
     */
    public void updateSnapshot(Snapshot snapshot) {
        SnapshotMapper.updateEntity(requireEntity(snapshot.id), snapshot);
    }

    public void updateRawJson(String snapshotId, String rawJson) {
        requireEntity(snapshotId).rawJson = rawJson;
    }

    private SnapshotEntity requireEntity(String snapshotId) {
        SnapshotEntity entity = findById(snapshotId);
        if (entity == null) {
            throw new IllegalStateException("Snapshot row missing: " + snapshotId);
        }
        return entity;
    }
}
