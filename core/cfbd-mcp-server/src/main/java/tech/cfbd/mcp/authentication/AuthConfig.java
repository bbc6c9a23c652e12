package tech.cfbd.mcp.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the authorization server and bearer gate.
 *
 * Example configuration:
 * <pre>
 * cfbd.auth.deployment-secret=${ANTHROPIC_BEARER_TOKEN}
 * cfbd.auth.token-store.file=${ISSUED_TOKENS_FILE:./issued_tokens.json}
 * cfbd.auth.authorization-code-expiry=PT10M
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "cfbd.auth")
public interface AuthConfig {

    /**
     * Shared secret gating this deployment. Startup fails when it is not set.
     */
    @WithName("deployment-secret")
    String deploymentSecret();

    /**
     * How long an authorization code stays exchangeable.
     * Default: 10 minutes
     */
    @WithName("authorization-code-expiry")
    @WithDefault("PT10M")
    Duration authorizationCodeExpiry();

    /**
     * Public base URL advertised as the issuer in discovery metadata.
     * When unset, the base URL of the incoming request is used.
     */
    @WithName("external-base-url")
    Optional<String> externalBaseUrl();

    /**
     * Durable token store configuration.
     */
    @WithName("token-store")
    TokenStoreConfig tokenStore();

    interface TokenStoreConfig {
        /**
         * JSON file holding every issued bearer token.
         */
        @WithDefault("./issued_tokens.json")
        String file();
    }
}
