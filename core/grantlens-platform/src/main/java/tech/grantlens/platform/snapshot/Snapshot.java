package tech.grantlens.platform.snapshot;

import java.time.Instant;

/**
 * A point-in-time capture of all principals and grants of one cluster.
 *
 * The raw entities are loaded separately through
 * {@link SnapshotRepository#findRawEntities(String)}; this class only carries the
 * lifecycle and the entity counts recorded when the capture was stored.
 */
public class Snapshot {

    public String id;

    /**
     * The cluster the capture was taken from.
     */
    public String clusterId;

    public SnapshotStatus status = SnapshotStatus.PENDING;

    public Instant createdAt = Instant.now();

    /**
     * Set when the collector stored the raw entities.
     */
    public Instant populatedAt;

    /**
     * Set when the snapshot reached a terminal status.
     */
    public Instant completedAt;

    /**
     * Collector error message for FAILED snapshots.
     */
    public String error;

    public Integer userCount;
    public Integer roleCount;
    public Integer grantCount;

    public Snapshot() {
    }

    public boolean isCompleted() {
        return status == SnapshotStatus.COMPLETED;
    }
}
