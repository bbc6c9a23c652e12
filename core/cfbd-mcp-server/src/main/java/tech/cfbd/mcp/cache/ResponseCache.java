package tech.cfbd.mcp.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.cfbd.mcp.upstream.UpstreamClient;
import tech.cfbd.mcp.upstream.UpstreamConfig;
import tech.cfbd.mcp.upstream.UpstreamError;
import tech.cfbd.mcp.upstream.UpstreamException;
import tech.cfbd.mcp.upstream.UpstreamRequest;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Cache-aside proxy in front of the upstream API.
 *
 * <p>For one call: cache get, then on a miss the upstream GET, then a cache
 * put, then the result is emitted. The put completes (or fails) before the
 * result is emitted, so a subsequent identical call can observe the entry.
 *
 * <p>The cache is optional. A failed or slow get counts as a miss, a failed
 * put is logged and ignored, and a cached entry that is not valid JSON is
 * invalidated and refetched. Upstream failures are never cached.
 */
@Singleton
public class ResponseCache {

    private static final Logger LOG = Logger.getLogger(ResponseCache.class);

    static final String CACHE_NAME = "responses";

    private final CacheStore cacheStore;
    private final UpstreamClient upstreamClient;
    private final EndpointTtlPolicy ttlPolicy;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration operationTimeout;
    private final InFlightRequests<JsonNode> inFlight;

    @Inject
    public ResponseCache(CacheStore cacheStore, UpstreamClient upstreamClient, EndpointTtlPolicy ttlPolicy,
                         ObjectMapper objectMapper, UpstreamConfig upstreamConfig, CacheConfig cacheConfig) {
        this(cacheStore, upstreamClient, ttlPolicy, objectMapper, upstreamConfig.baseUrl(),
            cacheConfig.operationTimeout(), cacheConfig.singleFlight());
    }

    ResponseCache(CacheStore cacheStore, UpstreamClient upstreamClient, EndpointTtlPolicy ttlPolicy,
                  ObjectMapper objectMapper, String baseUrl, Duration operationTimeout, boolean singleFlight) {
        this.cacheStore = cacheStore;
        this.upstreamClient = upstreamClient;
        this.ttlPolicy = ttlPolicy;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.operationTimeout = operationTimeout;
        this.inFlight = singleFlight ? new InFlightRequests<>() : null;
    }

    /**
     * Fetch an upstream GET through the cache.
     *
     * @param path   endpoint path, e.g. {@code /games}
     * @param params query parameters; null values are dropped
     * @return the parsed JSON body, or a failure carrying an {@link UpstreamException}
     */
    public Uni<JsonNode> fetch(String path, Map<String, ?> params) {
        UpstreamRequest request = UpstreamRequest.of(baseUrl, path, params);
        return lookup(request.cacheKey())
            .onItem().transformToUni(hit -> {
                if (hit.isPresent()) {
                    LOG.debugf("Cache hit for %s (%s)", request.path(), request.cacheKey());
                    return Uni.createFrom().item(hit.get());
                }
                LOG.debugf("Cache miss for %s (%s)", request.path(), request.cacheKey());
                return inFlight == null
                    ? load(request)
                    : inFlight.getOrLoad(request.cacheKey(), () -> load(request));
            });
    }

    private Uni<Optional<JsonNode>> lookup(String key) {
        if (!cacheStore.isAvailable()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom().deferred(() -> cacheStore.get(CACHE_NAME, key))
            .ifNoItem().after(operationTimeout).fail()
            .onFailure().recoverWithItem(e -> {
                LOG.warnf("Cache get failed for %s, treating as miss: %s", key, e.toString());
                return Optional.empty();
            })
            .onItem().transformToUni(cached -> cached.isPresent()
                ? parseCached(key, cached.get())
                : Uni.createFrom().item(Optional.<JsonNode>empty()));
    }

    private Uni<Optional<JsonNode>> parseCached(String key, String raw) {
        try {
            return Uni.createFrom().item(Optional.of(parse(raw)));
        } catch (JsonProcessingException e) {
            LOG.warnf("Cached entry %s is not valid JSON, invalidating", key);
            return Uni.createFrom().deferred(() -> cacheStore.invalidate(CACHE_NAME, key))
                .ifNoItem().after(operationTimeout).fail()
                .onFailure().recoverWithItem(failure -> {
                    LOG.warnf("Cache invalidate failed for %s: %s", key, failure.toString());
                    return null;
                })
                .replaceWith(Optional.<JsonNode>empty());
        }
    }

    private Uni<JsonNode> load(UpstreamRequest request) {
        return upstreamClient.get(request)
            .onItem().transformToUni(body -> {
                JsonNode json;
                try {
                    json = parse(body);
                } catch (JsonProcessingException e) {
                    LOG.warnf("Upstream returned invalid JSON for %s", request.path());
                    return Uni.createFrom().failure(new UpstreamException(UpstreamError.ApiError.invalidJson()));
                }
                return store(request, body).replaceWith(json);
            });
    }

    private JsonNode parse(String raw) throws JsonProcessingException {
        JsonNode json = raw == null ? null : objectMapper.readTree(raw);
        if (json == null || json.isMissingNode()) {
            throw new JsonMappingException(null, "Empty JSON document");
        }
        return json;
    }

    private Uni<Void> store(UpstreamRequest request, String body) {
        if (!cacheStore.isAvailable()) {
            return Uni.createFrom().voidItem();
        }
        Duration ttl = ttlPolicy.ttlFor(request.path());
        return Uni.createFrom().deferred(() -> cacheStore.put(CACHE_NAME, request.cacheKey(), body, ttl))
            .ifNoItem().after(operationTimeout).fail()
            .invoke(() -> LOG.debugf("Cached %s for %s", request.path(), ttl))
            .onFailure().recoverWithItem(e -> {
                LOG.warnf("Cache put failed for %s, continuing without caching: %s", request.cacheKey(), e.toString());
                return null;
            });
    }
}
