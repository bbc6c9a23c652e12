package tech.cfbd.mcp.mcp;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Live MCP sessions. In-memory only; clients re-initialize after a restart.
 *
 * Sessions that see no request for {@code cfbd.mcp.session-idle-timeout} are
 * dropped, so clients that disconnect without a DELETE do not accumulate.
 */
@Singleton
public class McpSessionManager {

    private static final Logger LOG = Logger.getLogger(McpSessionManager.class);

    private final Cache<String, McpSession> sessions;

    @Inject
    public McpSessionManager(McpConfig mcpConfig) {
        this(mcpConfig.sessionIdleTimeout(), Ticker.systemTicker());
    }

    McpSessionManager(Duration idleTimeout, Ticker ticker) {
        this.sessions = Caffeine.newBuilder()
            .expireAfterAccess(idleTimeout)
            .ticker(ticker)
            .removalListener((String id, McpSession session, RemovalCause cause) -> {
                if (cause == RemovalCause.EXPIRED) {
                    LOG.debugf("Expired idle MCP session %s", id);
                }
            })
            .build();
    }

    public McpSession create() {
        McpSession session = new McpSession();
        sessions.put(session.getSessionId(), session);
        LOG.debugf("Opened MCP session %s", session.getSessionId());
        return session;
    }

    public Optional<McpSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    public boolean remove(String sessionId) {
        boolean removed = sessionId != null && sessions.asMap().remove(sessionId) != null;
        if (removed) {
            LOG.debugf("Closed MCP session %s", sessionId);
        }
        return removed;
    }

    public int size() {
        sessions.cleanUp();
        return (int) sessions.estimatedSize();
    }
}
