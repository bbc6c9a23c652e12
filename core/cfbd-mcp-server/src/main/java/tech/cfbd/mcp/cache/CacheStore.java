package tech.cfbd.mcp.cache;

import io.smallrye.mutiny.Uni;

import java.time.Duration;
import java.util.Optional;

/**
 * Abstraction for caching with pluggable backends.
 *
 * <p>Supported backends:
 * <ul>
 *   <li>NONE - caching disabled, every lookup misses</li>
 *   <li>MEMORY - In-memory using Caffeine (single-node)</li>
 *   <li>REDIS - Redis (default, shared across instances)</li>
 * </ul>
 *
 * <p>Configure via:
 * <pre>
 * cfbd.cache.type=NONE|MEMORY|REDIS
 * cfbd.cache.ttl=PT5M
 * </pre>
 *
 * <p>Operations may fail; callers treat a failed get as a miss and a failed
 * put as a no-op.
 */
public interface CacheStore {

    /**
     * Get a cached value.
     *
     * @param cacheName The cache namespace (e.g., "responses")
     * @param key The cache key
     * @return The cached value, or empty if not found or expired
     */
    Uni<Optional<String>> get(String cacheName, String key);

    /**
     * Put a value in the cache.
     *
     * @param cacheName The cache namespace
     * @param key The cache key
     * @param value The value to cache (JSON string)
     * @param ttl Time-to-live for this entry
     */
    Uni<Void> put(String cacheName, String key, String value, Duration ttl);

    /**
     * Invalidate a specific cache entry.
     *
     * @param cacheName The cache namespace
     * @param key The cache key to invalidate
     */
    Uni<Void> invalidate(String cacheName, String key);

    /**
     * Whether this backend can be used at all. An unavailable store is
     * bypassed without being called.
     */
    boolean isAvailable();

    /**
     * Cache backend type.
     */
    enum CacheType {
        NONE,
        MEMORY,
        REDIS
    }
}
