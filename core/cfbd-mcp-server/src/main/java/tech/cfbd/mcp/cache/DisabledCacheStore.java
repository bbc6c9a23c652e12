package tech.cfbd.mcp.cache;

import io.smallrye.mutiny.Uni;

import java.time.Duration;
import java.util.Optional;

/**
 * Backend for {@code cfbd.cache.type=NONE}. Never stores anything.
 */
public class DisabledCacheStore implements CacheStore {

    @Override
    public Uni<Optional<String>> get(String cacheName, String key) {
        return Uni.createFrom().item(Optional.empty());
    }

    @Override
    public Uni<Void> put(String cacheName, String key, String value, Duration ttl) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Void> invalidate(String cacheName, String key) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
