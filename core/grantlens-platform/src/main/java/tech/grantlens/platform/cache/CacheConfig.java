package tech.grantlens.platform.cache;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the resolution caches.
 *
 * <p>Completed snapshots never change, so entries have no time-to-live; the caches are
 * bounded by size only.
 */
@ConfigMapping(prefix = "grantlens.cache")
public interface CacheConfig {

    /**
     * Maximum number of snapshot role graphs kept in memory.
     */
    @WithDefault("32")
    long graphMaxSize();

    /**
     * Maximum number of entries in every other cache (per-principal resolutions,
     * per-snapshot risk reports).
     */
    @WithDefault("10000")
    long resolutionMaxSize();
}
