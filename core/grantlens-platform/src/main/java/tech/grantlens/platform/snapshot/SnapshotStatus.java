package tech.grantlens.platform.snapshot;

/**
 * Snapshot lifecycle. PENDING moves to exactly one of the terminal states.
 */
public enum SnapshotStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
