package tech.grantlens.platform.snapshot;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for snapshot listing.
 *
 * Example configuration:
 * <pre>
 * grantlens.snapshots.default-list-limit=20
 * grantlens.snapshots.max-list-limit=100
 * </pre>
 */
@ConfigMapping(prefix = "grantlens.snapshots")
public interface SnapshotConfig {

    /**
     * Number of snapshots returned when the caller gives no limit.
     */
    @WithDefault("20")
    int defaultListLimit();

    /**
     * Upper bound for the caller-supplied limit.
     */
    @WithDefault("100")
    int maxListLimit();
}
