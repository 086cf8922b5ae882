package tech.grantlens.platform.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * In-memory memoization of values derived from completed snapshots, using Caffeine.
 *
 * <p>Every key must contain the snapshot id. Completed snapshots are immutable, so an
 * entry stays valid for as long as it is kept; there is no invalidation.
 *
 * <p>Each cache name gets its own Caffeine instance, so a loader may read from a
 * different cache while computing.
 */
@ApplicationScoped
public class ResolutionCache {

    private static final Logger LOG = Logger.getLogger(ResolutionCache.class);

    public static final String GRAPHS = "graphs";

    @Inject
    CacheConfig config;

    private final ConcurrentMap<String, Cache<Object, Object>> caches = new ConcurrentHashMap<>();

    public ResolutionCache() {
    }

    public ResolutionCache(CacheConfig config) {
        this.config = config;
    }

    private Cache<Object, Object> getCache(String cacheName) {
        return caches.computeIfAbsent(cacheName, name ->
            Caffeine.newBuilder()
                .maximumSize(GRAPHS.equals(name) ? config.graphMaxSize() : config.resolutionMaxSize())
                .build()
        );
    }

    /**
     * Return the cached value, computing and storing it on a miss.
     *
     * @param cacheName the cache namespace (e.g., "graphs")
     * @param key the cache key; must include the snapshot id
     * @param loader computes the value on a miss
     */
    @SuppressWarnings("unchecked")
    public <V> V get(String cacheName, Object key, Supplier<V> loader) {
        Cache<Object, Object> cache = getCache(cacheName);
        Object cached = cache.getIfPresent(key);
        if (cached != null) {
            LOG.debugf("Cache hit in %s for %s", cacheName, key);
            return (V) cached;
        }
        LOG.debugf("Cache miss in %s for %s", cacheName, key);
        return (V) cache.get(key, k -> loader.get());
    }

    /**
     * Number of live entries in a cache namespace.
     */
    public long size(String cacheName) {
        Cache<Object, Object> cache = caches.get(cacheName);
        return cache == null ? 0 : cache.estimatedSize();
    }
}
