package tech.cfbd.mcp.cache;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

/**
 * Configuration for the response cache.
 */
@ConfigMapping(prefix = "cfbd.cache")
public interface CacheConfig {

    /**
     * Cache backend type: NONE, MEMORY, or REDIS.
     */
    @WithDefault("REDIS")
    CacheStore.CacheType type();

    /**
     * Time-to-live for endpoints without an entry in {@link EndpointTtlPolicy}.
     */
    @WithDefault("PT5M")
    Duration ttl();

    /**
     * Ceiling on a single cache get or put. Slower operations count as a miss.
     */
    @WithName("operation-timeout")
    @WithDefault("PT0.5S")
    Duration operationTimeout();

    /**
     * Maximum number of entries per cache (for in-memory cache).
     */
    @WithName("max-size")
    @WithDefault("10000")
    long maxSize();

    /**
     * Share one upstream call between concurrent misses for the same key.
     */
    @WithName("single-flight")
    @WithDefault("false")
    boolean singleFlight();

    /**
     * Redis configuration (only used when type=REDIS).
     */
    Redis redis();

    interface Redis {
        /**
         * Redis key prefix for cache entries.
         */
        @WithName("key-prefix")
        @WithDefault("cfbd:cache:")
        String keyPrefix();
    }
}
