package tech.grantlens.platform.common.errors;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Sealed error hierarchy for explorer, snapshot and diff failures.
 *
 * Every error is deterministic and recoverable by the caller; none is retried.
 * Errors are categorized by type to enable consistent HTTP status mapping
 * and client-side handling. {@link #details()} always names the offending identifier.
 */
public sealed interface ExplorerError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Unknown cluster, snapshot, user or role.
     * Maps to HTTP 404 Not Found.
     */
    record NotFound(
        String code,
        String message,
        Map<String, Object> details
    ) implements ExplorerError {}

    /**
     * Snapshot exists but is pending or failed.
     * Maps to HTTP 409 Conflict so the caller can tell the user to collect or wait.
     */
    record SnapshotNotReady(
        String code,
        String message,
        Map<String, Object> details
    ) implements ExplorerError {}

    /**
     * Diff requested between snapshots of different clusters, or a snapshot and itself.
     * Maps to HTTP 400 Bad Request.
     */
    record InvalidDiffPair(
        String code,
        String message,
        Map<String, Object> details
    ) implements ExplorerError {}

    /**
     * Input validation failed (missing cluster, unknown query option, etc.)
     * Maps to HTTP 400 Bad Request.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements ExplorerError {}

    /**
     * Illegal snapshot lifecycle transition (writing to a completed snapshot, etc.)
     * Maps to HTTP 409 Conflict.
     */
    record SnapshotStateConflict(
        String code,
        String message,
        Map<String, Object> details
    ) implements ExplorerError {}

    // ========================================================================
    // Factories
    // ========================================================================

    static NotFound notFound(String resourceType, String identifier) {
        return new NotFound(
            resourceType.toUpperCase(Locale.ROOT).replace(' ', '_') + "_NOT_FOUND",
            capitalize(resourceType) + " not found: " + identifier,
            details("resourceType", resourceType, "identifier", identifier));
    }

    static SnapshotNotReady snapshotNotReady(String snapshotId, String status) {
        return new SnapshotNotReady(
            "SNAPSHOT_NOT_READY",
            "Snapshot " + snapshotId + " is " + status.toLowerCase(Locale.ROOT) + ", not completed",
            details("snapshotId", snapshotId, "status", status));
    }

    static InvalidDiffPair invalidDiffPair(String fromId, String toId, String reason) {
        return new InvalidDiffPair(
            "INVALID_DIFF_PAIR",
            "Cannot diff " + fromId + " against " + toId + ": " + reason,
            details("fromSnapshotId", fromId, "toSnapshotId", toId));
    }

    static ValidationError validation(String field, String message) {
        return new ValidationError("VALIDATION_ERROR", message, details("field", field));
    }

    static SnapshotStateConflict stateConflict(String snapshotId, String status, String attempted) {
        return new SnapshotStateConflict(
            "SNAPSHOT_STATE_CONFLICT",
            "Cannot " + attempted + " snapshot " + snapshotId + " in status " + status,
            details("snapshotId", snapshotId, "status", status));
    }

    private static Map<String, Object> details(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(k1, v1);
        details.put(k2, v2);
        return details;
    }

    private static Map<String, Object> details(String k1, Object v1) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(k1, v1);
        return details;
    }

    private static String capitalize(String value) {
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
