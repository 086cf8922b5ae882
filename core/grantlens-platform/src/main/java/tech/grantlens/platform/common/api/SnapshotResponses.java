package tech.grantlens.platform.common.api;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import tech.grantlens.platform.snapshot.Snapshot;
import tech.grantlens.platform.snapshot.SnapshotStatus;

import java.time.Instant;
import java.util.List;

/**
 * Request and response DTOs for the snapshot endpoints.
 */
public final class SnapshotResponses {

    private SnapshotResponses() {}

    @Schema(description = "Snapshot lifecycle and entity counts")
    public record SnapshotDto(
        @Schema(description = "Snapshot ID", example = "snp_0HZXEQ5Y8JY5Z")
        String id,
        @Schema(description = "Cluster the capture was taken from", example = "prod-eu")
        String clusterId,
        SnapshotStatus status,
        Instant createdAt,
        Instant populatedAt,
        Instant completedAt,
        @Schema(description = "Collector error for failed snapshots")
        String error,
        Integer userCount,
        Integer roleCount,
        Integer grantCount
    ) {
        public static SnapshotDto from(Snapshot snapshot) {
            return new SnapshotDto(
                snapshot.id,
                snapshot.clusterId,
                snapshot.status,
                snapshot.createdAt,
                snapshot.populatedAt,
                snapshot.completedAt,
                snapshot.error,
                snapshot.userCount,
                snapshot.roleCount,
                snapshot.grantCount
            );
        }
    }

    @Schema(description = "Snapshot list response")
    public record SnapshotListResponse(
        @Schema(description = "Snapshots, newest first")
        List<SnapshotDto> snapshots,
        @Schema(description = "Number of snapshots returned")
        int total
    ) {}

    @Schema(description = "Request to open a new capture")
    public record CreateSnapshotRequest(
        @Schema(description = "Cluster being captured", example = "prod-eu", required = true)
        String clusterId
    ) {}

    @Schema(description = "Request to mark a capture as failed")
    public record FailSnapshotRequest(
        @Schema(description = "Collector error message", example = "Connection refused")
        String error
    ) {}
}
