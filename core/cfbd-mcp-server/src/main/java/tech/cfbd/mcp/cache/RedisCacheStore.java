package tech.cfbd.mcp.cache;

import io.quarkus.arc.lookup.LookupIfProperty;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed cache implementation using the Quarkus reactive Redis client.
 *
 * <p>Entries are written with SETEX under {@code <prefix><cacheName>:<key>}.
 * The connection is opened lazily on first use, so an unreachable server
 * surfaces as failed operations rather than a failed startup.
 *
 * <p>Note: @Typed excludes CacheStore from bean types so only the
 * CacheStoreProducer can provide the CacheStore interface.
 */
@Singleton
@Typed(RedisCacheStore.class)
@LookupIfProperty(name = "cfbd.cache.type", stringValue = "REDIS", lookupIfMissing = true)
public class RedisCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(RedisCacheStore.class);

    @Inject
    CacheConfig config;

    @Inject
    Instance<ReactiveRedisDataSource> redisDataSourceInstance;

    private ReactiveValueCommands<String, String> valueCommands;
    private ReactiveKeyCommands<String> keyCommands;

    @PostConstruct
    void init() {
        if (redisDataSourceInstance.isResolvable()) {
            ReactiveRedisDataSource redis = redisDataSourceInstance.get();
            this.valueCommands = redis.value(String.class);
            this.keyCommands = redis.key();
            LOG.info("RedisCacheStore initialized with Quarkus Redis client");
        } else {
            LOG.warn("Redis cache selected but no Redis client is available; caching disabled");
        }
    }

    private String buildKey(String cacheName, String key) {
        return config.redis().keyPrefix() + cacheName + ":" + key;
    }

    @Override
    public Uni<Optional<String>> get(String cacheName, String key) {
        if (!isAvailable()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return valueCommands.get(buildKey(cacheName, key)).map(Optional::ofNullable);
    }

    @Override
    public Uni<Void> put(String cacheName, String key, String value, Duration ttl) {
        if (!isAvailable()) {
            return Uni.createFrom().voidItem();
        }
        long seconds = Math.max(1, ttl.toSeconds());
        return valueCommands.setex(buildKey(cacheName, key), seconds, value);
    }

    @Override
    public Uni<Void> invalidate(String cacheName, String key) {
        if (!isAvailable()) {
            return Uni.createFrom().voidItem();
        }
        return keyCommands.del(buildKey(cacheName, key)).replaceWithVoid();
    }

    @Override
    public boolean isAvailable() {
        return valueCommands != null;
    }
}
