package tech.cfbd.mcp.upstream;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

/**
 * Connection settings for the College Football Data API.
 */
@ConfigMapping(prefix = "cfbd.upstream")
public interface UpstreamConfig {

    /**
     * API key sent as a bearer token on every upstream call.
     */
    @WithName("api-key")
    String apiKey();

    @WithName("base-url")
    @WithDefault("https://apinext.collegefootballdata.com")
    String baseUrl();

    /**
     * Ceiling for a single upstream call, connect included.
     */
    @WithDefault("PT30S")
    Duration timeout();
}
