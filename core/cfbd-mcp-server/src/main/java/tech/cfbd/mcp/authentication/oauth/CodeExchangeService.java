package tech.cfbd.mcp.authentication.oauth;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cfbd.mcp.authentication.token.SessionRegistry;
import tech.cfbd.mcp.authentication.token.TokenStore;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Grant issuance and authorization code exchange.
 *
 * <pre>
 * NO_GRANT --authorize--> GRANT_PENDING --exchange--> TOKEN_ISSUED
 * </pre>
 *
 * Exchange checks, in order: the code exists (InvalidGrant), the client id and
 * redirect URI match the grant (ClientMismatch), the verifier reproduces the
 * challenge (PkceFailure). A successful exchange consumes the grant, so the
 * same code cannot be exchanged twice.
 */
@ApplicationScoped
public class CodeExchangeService {

    private static final Logger LOG = Logger.getLogger(CodeExchangeService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final AuthorizationCodeStore codeStore;
    private final TokenStore tokenStore;
    private final SessionRegistry sessionRegistry;
    private final PkceService pkceService;

    @Inject
    public CodeExchangeService(AuthorizationCodeStore codeStore, TokenStore tokenStore,
                               SessionRegistry sessionRegistry, PkceService pkceService) {
        this.codeStore = codeStore;
        this.tokenStore = tokenStore;
        this.sessionRegistry = sessionRegistry;
        this.pkceService = pkceService;
    }

    /**
     * Store a pending grant and return it with its fresh one-time code.
     */
    public AuthorizationGrant createGrant(String clientId, String redirectUri, String scope,
                                          String codeChallenge, String codeChallengeMethod) {
        AuthorizationGrant grant = new AuthorizationGrant(
            generateAuthorizationCode(),
            clientId,
            redirectUri,
            scope,
            codeChallenge,
            codeChallengeMethod,
            Instant.now()
        );
        codeStore.save(grant);
        LOG.infof("Authorization code issued for client %s", clientId);
        return grant;
    }

    /**
     * Exchange an authorization code for a bearer token.
     *
     * <p>The token is durably recorded in the token store before the returned
     * Uni emits.
     *
     * @return the issued token, or a failure carrying an {@link OAuthException}
     */
    public Uni<IssuedToken> exchange(String code, String clientId, String redirectUri, String codeVerifier) {
        AuthorizationGrant grant;
        try {
            grant = validate(code, clientId, redirectUri, codeVerifier);
        } catch (OAuthException e) {
            return Uni.createFrom().failure(e);
        }

        String token = generateAccessToken();
        return tokenStore.issue(token)
            .map(ignored -> {
                String sessionId = sessionRegistry.open(token);
                LOG.infof("Token issued for client %s via authorization_code grant: %s...",
                    grant.clientId(), prefix(token));
                return new IssuedToken(token, sessionId);
            });
    }

    private AuthorizationGrant validate(String code, String clientId, String redirectUri, String codeVerifier) {
        AuthorizationGrant grant = codeStore.find(code).orElse(null);
        if (grant == null) {
            LOG.warn("Token request with invalid authorization code");
            throw new OAuthException.InvalidGrant();
        }
        if (!grant.isBoundTo(clientId, redirectUri)) {
            LOG.warnf("Token request for code issued to %s presented client %s", grant.clientId(), clientId);
            throw new OAuthException.ClientMismatch();
        }
        if (!pkceService.verifyCodeChallenge(codeVerifier, grant.codeChallenge())) {
            LOG.warnf("PKCE verification failed for client %s", clientId);
            throw new OAuthException.PkceFailure();
        }
        // Single use: a concurrent exchange that got here first wins.
        if (!codeStore.consume(grant)) {
            LOG.warnf("Authorization code for client %s was already exchanged", clientId);
            throw new OAuthException.InvalidGrant();
        }
        return grant;
    }

    private String generateAuthorizationCode() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private String generateAccessToken() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    static String prefix(String token) {
        return token.length() <= 8 ? token : token.substring(0, 8);
    }

    /**
     * A freshly minted bearer token and the session attached to it.
     */
    public record IssuedToken(String accessToken, String sessionId) {
    }
}
