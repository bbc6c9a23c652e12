package tech.cfbd.mcp.cache;

import io.smallrye.mutiny.Uni;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of in-progress loads, so concurrent misses for one key share a
 * single upstream call.
 *
 * The shared Uni is memoized for the duration of the load and dropped from
 * the registry as soon as it terminates, successfully or not.
 */
class InFlightRequests<T> {

    private final ConcurrentHashMap<String, Uni<T>> inflight = new ConcurrentHashMap<>();

    Uni<T> getOrLoad(String key, Supplier<Uni<T>> loader) {
        return Uni.createFrom().deferred(() -> inflight.computeIfAbsent(key, k ->
            loader.get()
                .onTermination().invoke(() -> inflight.remove(k))
                .memoize().indefinitely()));
    }

    int size() {
        return inflight.size();
    }
}
