package tech.grantlens.platform.snapshot;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.grantlens.platform.common.errors.ExplorerError;
import tech.grantlens.platform.common.errors.ExplorerException;
import tech.grantlens.platform.shared.EntityType;
import tech.grantlens.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot store operations.
 *
 * Write side (used by the external collector): a snapshot is created PENDING, populated
 * with raw entities while still PENDING, then moved to COMPLETED or FAILED. Both are
 * terminal; nothing about a terminal snapshot can change afterwards.
 *
 * Read side: raw entities are only handed out for COMPLETED snapshots, so resolution
 * never observes a partially written capture.
 */
@ApplicationScoped
public class SnapshotService {

    private static final Logger LOG = Logger.getLogger(SnapshotService.class);

    @Inject
    SnapshotRepository snapshotRepo;

    @Inject
    SnapshotConfig config;

    // ==================== Lifecycle ====================

    public Snapshot create(String clusterId) {
        requireClusterId(clusterId);

        Snapshot snapshot = new Snapshot();
        snapshot.id = TsidGenerator.generate(EntityType.SNAPSHOT);
        snapshot.clusterId = clusterId;
        snapshot.status = SnapshotStatus.PENDING;
        snapshot.createdAt = Instant.now();
        snapshotRepo.persist(snapshot);

        LOG.infof("Created snapshot %s for cluster %s", snapshot.id, clusterId);
        return snapshot;
    }

    public Snapshot populate(String snapshotId, RawEntities rawEntities) {
        if (rawEntities == null) {
            throw new ExplorerException(ExplorerError.validation("entities", "Raw entities are required"));
        }
        Snapshot snapshot = requirePending(snapshotId, "populate");

        snapshotRepo.storeRawEntities(snapshotId, rawEntities);
        snapshot.populatedAt = Instant.now();
        snapshot.userCount = rawEntities.users().size();
        snapshot.roleCount = rawEntities.roles().size();
        snapshot.grantCount = rawEntities.grants().size();
        snapshotRepo.update(snapshot);

        LOG.infof("Stored %d users, %d roles, %d role grants, %d grants in snapshot %s",
            rawEntities.users().size(), rawEntities.roles().size(),
            rawEntities.roleGrants().size(), rawEntities.grants().size(), snapshotId);
        return snapshot;
    }

    public Snapshot complete(String snapshotId) {
        Snapshot snapshot = requirePending(snapshotId, "complete");
        if (snapshot.populatedAt == null) {
            throw new ExplorerException(ExplorerError.stateConflict(
                snapshotId, snapshot.status.name(), "complete unpopulated"));
        }

        snapshot.status = SnapshotStatus.COMPLETED;
        snapshot.completedAt = Instant.now();
        snapshotRepo.update(snapshot);

        LOG.infof("Snapshot %s of cluster %s completed", snapshotId, snapshot.clusterId);
        return snapshot;
    }

    public Snapshot fail(String snapshotId, String error) {
        Snapshot snapshot = requirePending(snapshotId, "fail");

        snapshot.status = SnapshotStatus.FAILED;
        snapshot.error = error != null && !error.isBlank() ? error : "Collection failed";
        snapshot.completedAt = Instant.now();
        snapshotRepo.update(snapshot);

        LOG.warnf("Snapshot %s of cluster %s failed: %s", snapshotId, snapshot.clusterId, snapshot.error);
        return snapshot;
    }

    // ==================== Reads ====================

    /**
     * Look up a snapshot in any status.
     *
     * @throws ExplorerException NotFound if the id is unknown
     */
    public Snapshot getSnapshot(String snapshotId) {
        if (snapshotId == null || snapshotId.isBlank()) {
            throw new ExplorerException(ExplorerError.validation("snapshot_id", "snapshot_id is required"));
        }
        if (!TsidGenerator.hasType(snapshotId, EntityType.SNAPSHOT)) {
            throw new ExplorerException(ExplorerError.notFound("snapshot", snapshotId));
        }
        return snapshotRepo.findByIdOptional(snapshotId)
            .orElseThrow(() -> new ExplorerException(ExplorerError.notFound("snapshot", snapshotId)));
    }

    /**
     * Look up a snapshot that must be COMPLETED.
     *
     * @throws ExplorerException NotFound if unknown, SnapshotNotReady if pending or failed
     */
    public Snapshot getCompleted(String snapshotId) {
        Snapshot snapshot = getSnapshot(snapshotId);
        if (!snapshot.isCompleted()) {
            throw new ExplorerException(ExplorerError.snapshotNotReady(snapshotId, snapshot.status.name()));
        }
        return snapshot;
    }

    /**
     * Raw entities of a COMPLETED snapshot.
     */
    public RawEntities getRawEntities(String snapshotId) {
        getCompleted(snapshotId);
        return snapshotRepo.findRawEntities(snapshotId)
            .orElseThrow(() -> new ExplorerException(ExplorerError.notFound("snapshot", snapshotId)));
    }

    /**
     * Pick the snapshot a read query runs against.
     *
     * @param clusterId the cluster being explored (required)
     * @param snapshotId explicit snapshot, or null for the most recently completed one
     */
    public Snapshot select(String clusterId, String snapshotId) {
        requireClusterId(clusterId);

        if (snapshotId != null && !snapshotId.isBlank()) {
            Snapshot snapshot = getSnapshot(snapshotId);
            if (!clusterId.equals(snapshot.clusterId)) {
                throw new ExplorerException(ExplorerError.notFound("snapshot", snapshotId));
            }
            if (!snapshot.isCompleted()) {
                throw new ExplorerException(ExplorerError.snapshotNotReady(snapshotId, snapshot.status.name()));
            }
            return snapshot;
        }

        return snapshotRepo.findLatestCompleted(clusterId)
            .orElseThrow(() -> noCompletedSnapshot(clusterId));
    }

    public List<Snapshot> listSnapshots(String clusterId, Integer limit) {
        requireClusterId(clusterId);
        int effectiveLimit = limit == null ? config.defaultListLimit() : limit;
        if (effectiveLimit < 1 || effectiveLimit > config.maxListLimit()) {
            throw new ExplorerException(ExplorerError.validation("limit",
                "limit must be between 1 and " + config.maxListLimit()));
        }
        return snapshotRepo.findByClusterId(clusterId, effectiveLimit);
    }

    // ==================== Helpers ====================

    private ExplorerException noCompletedSnapshot(String clusterId) {
        if (!snapshotRepo.existsForCluster(clusterId)) {
            return new ExplorerException(ExplorerError.notFound("cluster", clusterId));
        }
        // Report the newest capture, which is what the caller would wait on.
        return snapshotRepo.findByClusterId(clusterId, 1).stream()
            .findFirst()
            .map(latest -> new ExplorerException(ExplorerError.snapshotNotReady(latest.id, latest.status.name())))
            .orElseGet(() -> new ExplorerException(ExplorerError.notFound("cluster", clusterId)));
    }

    private Snapshot requirePending(String snapshotId, String attempted) {
        Snapshot snapshot = getSnapshot(snapshotId);
        if (snapshot.status != SnapshotStatus.PENDING) {
            throw new ExplorerException(ExplorerError.stateConflict(snapshotId, snapshot.status.name(), attempted));
        }
        return snapshot;
    }

    private static void requireClusterId(String clusterId) {
        if (clusterId == null || clusterId.isBlank()) {
            throw new ExplorerException(ExplorerError.validation("cluster_id", "cluster_id is required"));
        }
    }
}
