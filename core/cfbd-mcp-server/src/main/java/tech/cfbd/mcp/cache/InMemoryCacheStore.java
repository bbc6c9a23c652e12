package tech.cfbd.mcp.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory cache implementation using Caffeine.
 *
 * <p>Fast, single-node caching. Not shared across multiple instances.
 * Each entry carries its own TTL through a Caffeine {@link Expiry}.
 *
 * <p>Note: @Typed excludes CacheStore from bean types so only the
 * CacheStoreProducer can provide the CacheStore interface.
 */
@Singleton
@Typed(InMemoryCacheStore.class)
public class InMemoryCacheStore implements CacheStore {

    private final long maxSize;
    private final Ticker ticker;
    private final ConcurrentMap<String, Cache<String, Entry>> caches = new ConcurrentHashMap<>();

    @Inject
    public InMemoryCacheStore(CacheConfig config) {
        this(config.maxSize(), Ticker.systemTicker());
    }

    InMemoryCacheStore(long maxSize, Ticker ticker) {
        this.maxSize = maxSize;
        this.ticker = ticker;
    }

    private Cache<String, Entry> getCache(String cacheName) {
        return caches.computeIfAbsent(cacheName, name ->
            Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .maximumSize(maxSize)
                .ticker(ticker)
                .build()
        );
    }

    @Override
    public Uni<Optional<String>> get(String cacheName, String key) {
        return Uni.createFrom().item(() ->
            Optional.ofNullable(getCache(cacheName).getIfPresent(key)).map(Entry::value));
    }

    @Override
    public Uni<Void> put(String cacheName, String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            getCache(cacheName).put(key, new Entry(value, ttl));
            return null;
        });
    }

    @Override
    public Uni<Void> invalidate(String cacheName, String key) {
        return Uni.createFrom().item(() -> {
            getCache(cacheName).invalidate(key);
            return null;
        });
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private record Entry(String value, Duration ttl) {
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
