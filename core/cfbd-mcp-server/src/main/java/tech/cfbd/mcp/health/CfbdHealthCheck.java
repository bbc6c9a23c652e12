package tech.cfbd.mcp.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import tech.cfbd.mcp.authentication.token.TokenStore;
import tech.cfbd.mcp.cache.CacheConfig;
import tech.cfbd.mcp.cache.CacheStore;
import tech.cfbd.mcp.mcp.McpSessionManager;

/**
 * Readiness check for the MCP server.
 *
 * Always UP: the response cache and token persistence are optional, so a
 * failure of either only shows up as degraded data here.
 */
@ApplicationScoped
@Readiness
public class CfbdHealthCheck implements HealthCheck {

    @Inject
    CacheConfig cacheConfig;

    @Inject
    CacheStore cacheStore;

    @Inject
    TokenStore tokenStore;

    @Inject
    McpSessionManager sessionManager;

    @Override
    public HealthCheckResponse call() {
        boolean degraded = !tokenStore.isPersistent()
            || (cacheConfig.type() != CacheStore.CacheType.NONE && !cacheStore.isAvailable());

        return HealthCheckResponse.builder()
            .name("cfbd-mcp")
            .up()
            .withData("cacheType", cacheConfig.type().name())
            .withData("cacheAvailable", cacheStore.isAvailable())
            .withData("issuedTokens", tokenStore.size())
            .withData("tokenStorePersistent", tokenStore.isPersistent())
            .withData("mcpSessions", sessionManager.size())
            .withData("degraded", degraded)
            .build();
    }
}
