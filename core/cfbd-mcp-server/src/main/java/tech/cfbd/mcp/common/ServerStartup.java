package tech.cfbd.mcp.common;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cfbd.mcp.authentication.AuthConfig;
import tech.cfbd.mcp.authentication.token.TokenStore;
import tech.cfbd.mcp.cache.CacheConfig;
import tech.cfbd.mcp.cache.CacheStore;
import tech.cfbd.mcp.upstream.UpstreamConfig;

/**
 * Startup checks and configuration summary.
 *
 * <p>Secrets are never logged. Startup is aborted when the deployment secret
 * or the upstream API key is blank.
 */
@ApplicationScoped
public class ServerStartup {

    private static final Logger LOG = Logger.getLogger(ServerStartup.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    UpstreamConfig upstreamConfig;

    @Inject
    CacheConfig cacheConfig;

    @Inject
    ServerConfig serverConfig;

    @Inject
    CacheStore cacheStore;

    @Inject
    TokenStore tokenStore;

    void onStart(@Observes StartupEvent event) {
        requireNonBlank(authConfig.deploymentSecret(), "cfbd.auth.deployment-secret (ANTHROPIC_BEARER_TOKEN)");
        requireNonBlank(upstreamConfig.apiKey(), "cfbd.upstream.api-key (CFB_API_KEY)");

        if (serverConfig.debug()) {
            LOG.info("Request header logging enabled (needs DEBUG level on tech.cfbd)");
        }

        LOG.infof("CFBD MCP server started: upstream=%s, timeout=%s", upstreamConfig.baseUrl(), upstreamConfig.timeout());
        LOG.infof("Response cache: type=%s, available=%s, default ttl=%s, single-flight=%s",
            cacheConfig.type(), cacheStore.isAvailable(), cacheConfig.ttl(), cacheConfig.singleFlight());
        LOG.infof("Token store: file=%s, tokens=%d, persistent=%s",
            authConfig.tokenStore().file(), tokenStore.size(), tokenStore.isPersistent());

        if (cacheConfig.type() != CacheStore.CacheType.NONE && !cacheStore.isAvailable()) {
            LOG.warn("Response cache unavailable, every tool call will reach the upstream API");
        }
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.infof("CFBD MCP server shutdown: %d issued tokens retained in %s",
            tokenStore.size(), authConfig.tokenStore().file());
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(name + " must be set");
        }
    }
}
