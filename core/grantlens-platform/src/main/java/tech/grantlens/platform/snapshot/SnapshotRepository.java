package tech.grantlens.platform.snapshot;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for snapshots and their captured raw entities.
 */
public interface SnapshotRepository {

    // Read operations
    Optional<Snapshot> findByIdOptional(String id);

    /**
     * Snapshots of a cluster, newest first.
     */
    List<Snapshot> findByClusterId(String clusterId, int limit);

    Optional<Snapshot> findLatestCompleted(String clusterId);

    boolean existsForCluster(String clusterId);

    Optional<RawEntities> findRawEntities(String snapshotId);

    // Write operations
    void persist(Snapshot snapshot);
    void update(Snapshot snapshot);
    void storeRawEntities(String snapshotId, RawEntities rawEntities);
}
