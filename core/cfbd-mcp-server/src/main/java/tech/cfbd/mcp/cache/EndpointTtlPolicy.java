package tech.cfbd.mcp.cache;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.Map;

/**
 * Time-to-live per upstream endpoint.
 *
 * Game, play and drive data moves during a season and is kept for ten
 * minutes. Rankings, records and derived metrics change at most weekly and
 * are kept for an hour. Everything else uses {@code cfbd.cache.ttl}.
 */
@Singleton
public class EndpointTtlPolicy {

    static final Duration LIVE_DATA_TTL = Duration.ofMinutes(10);
    static final Duration SEASON_DATA_TTL = Duration.ofHours(1);

    private static final Map<String, Duration> TTL_BY_PATH = Map.of(
        "/games", LIVE_DATA_TTL,
        "/games/teams", LIVE_DATA_TTL,
        "/plays", LIVE_DATA_TTL,
        "/drives", LIVE_DATA_TTL,
        "/play/stats", LIVE_DATA_TTL,
        "/rankings", SEASON_DATA_TTL,
        "/records", SEASON_DATA_TTL,
        "/metrics/wp/pregame", SEASON_DATA_TTL,
        "/game/box/advanced", SEASON_DATA_TTL
    );

    private final Duration defaultTtl;

    @Inject
    public EndpointTtlPolicy(CacheConfig config) {
        this(config.ttl());
    }

    EndpointTtlPolicy(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    /**
     * @param path normalized endpoint path, leading slash, no trailing slash
     */
    public Duration ttlFor(String path) {
        return TTL_BY_PATH.getOrDefault(path, defaultTtl);
    }
}
