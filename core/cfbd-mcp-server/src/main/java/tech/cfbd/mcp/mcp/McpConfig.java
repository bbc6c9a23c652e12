package tech.cfbd.mcp.mcp;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

/**
 * Configuration for the MCP streamable-HTTP transport.
 */
@ConfigMapping(prefix = "cfbd.mcp")
public interface McpConfig {

    /**
     * Always reply with application/json, even to clients that accept SSE.
     */
    @WithName("json-response")
    @WithDefault("false")
    boolean jsonResponse();

    @WithName("server-name")
    @WithDefault("cfbd-mcp-server")
    String serverName();

    @WithName("server-version")
    @WithDefault("0.5.0")
    String serverVersion();

    /**
     * Idle time after which a session without a DELETE is forgotten.
     */
    @WithName("session-idle-timeout")
    @WithDefault("PT1H")
    Duration sessionIdleTimeout();
}
