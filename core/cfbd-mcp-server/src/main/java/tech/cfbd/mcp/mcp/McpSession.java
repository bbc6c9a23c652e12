package tech.cfbd.mcp.mcp;

import java.time.Instant;
import java.util.UUID;

/**
 * State of one MCP client connection, identified by the Mcp-Session-Id header.
 */
public class McpSession {

    private final String sessionId = UUID.randomUUID().toString().replace("-", "");
    private final Instant createdAt = Instant.now();
    private volatile String protocolVersion;
    private volatile String clientName;
    private volatile String clientVersion;
    private volatile boolean initialized;

    public String getSessionId() {
        return sessionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public void setProtocolVersion(String protocolVersion) {
        this.protocolVersion = protocolVersion;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public String getClientVersion() {
        return clientVersion;
    }

    public void setClientVersion(String clientVersion) {
        this.clientVersion = clientVersion;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }
}
