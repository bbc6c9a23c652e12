package tech.cfbd.mcp.authentication.oauth;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.cfbd.mcp.authentication.AuthConfig;

import java.time.Duration;
import java.util.Optional;

/**
 * Pending authorization grants keyed by one-time code.
 *
 * Codes are single-use: {@link #consume} removes the grant atomically, so of
 * two concurrent exchanges for the same code exactly one succeeds. Grants that
 * are never exchanged expire after {@code cfbd.auth.authorization-code-expiry}.
 */
@Singleton
public class AuthorizationCodeStore {

    private final Cache<String, AuthorizationGrant> grants;

    @Inject
    public AuthorizationCodeStore(AuthConfig authConfig) {
        this(authConfig.authorizationCodeExpiry(), Ticker.systemTicker());
    }

    AuthorizationCodeStore(Duration expiry, Ticker ticker) {
        this.grants = Caffeine.newBuilder()
            .expireAfterWrite(expiry)
            .ticker(ticker)
            .build();
    }

    public void save(AuthorizationGrant grant) {
        grants.put(grant.code(), grant);
    }

    public Optional<AuthorizationGrant> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(grants.getIfPresent(code));
    }

    /**
     * Remove the grant if it is still the one stored under its code.
     *
     * @return true if this caller consumed the grant
     */
    public boolean consume(AuthorizationGrant grant) {
        return grants.asMap().remove(grant.code(), grant);
    }

    public long size() {
        grants.cleanUp();
        return grants.estimatedSize();
    }
}
