package tech.cfbd.mcp.authentication.oauth;

import java.time.Instant;
import java.util.Objects;

/**
 * A pending authorization, created by /authorize and consumed by /token.
 *
 * Bound to the client id, redirect URI and PKCE challenge presented at
 * /authorize; all three must match again at exchange time.
 *
 * @param code                one-time authorization code
 * @param clientId            client that initiated the authorization
 * @param redirectUri         redirect URI used in the authorization request
 * @param scope               requested scopes, informational only
 * @param codeChallenge       S256 PKCE challenge
 * @param codeChallengeMethod always "S256"
 * @param createdAt           issuance time
 */
public record AuthorizationGrant(
    String code,
    String clientId,
    String redirectUri,
    String scope,
    String codeChallenge,
    String codeChallengeMethod,
    Instant createdAt
) {
    public AuthorizationGrant {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(clientId, "clientId is required");
        Objects.requireNonNull(redirectUri, "redirectUri is required");
        Objects.requireNonNull(codeChallenge, "codeChallenge is required");
    }

    public boolean isBoundTo(String presentedClientId, String presentedRedirectUri) {
        return clientId.equals(presentedClientId) && redirectUri.equals(presentedRedirectUri);
    }
}
