package tech.cfbd.mcp.authentication.token;

import jakarta.inject.Singleton;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session identifiers attached to issued tokens.
 *
 * Never consulted for authorization decisions. In-memory only, so sessions do
 * not survive a restart even though their tokens do.
 */
@Singleton
public class SessionRegistry {

    private final Map<String, String> sessionsByToken = new ConcurrentHashMap<>();

    /**
     * Attach a freshly generated session id to a token.
     *
     * @return the new session id
     */
    public String open(String token) {
        String sessionId = UUID.randomUUID().toString().replace("-", "");
        sessionsByToken.put(token, sessionId);
        return sessionId;
    }

    public Optional<String> sessionFor(String token) {
        return Optional.ofNullable(sessionsByToken.get(token));
    }
}
