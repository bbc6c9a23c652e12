package tech.cfbd.mcp.common;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Process-level switches.
 */
@StaticInitSafe
@ConfigMapping(prefix = "cfbd.server")
public interface ServerConfig {

    /**
     * Verbose logging for tech.cfbd plus per-request header logging.
     * Set from the DEBUG environment variable ({@code 1} or {@code true}).
     */
    @WithDefault("false")
    boolean debug();
}
