package tech.cfbd.mcp.authentication.oauth;

import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * OAuth2 Authorization Code flow with PKCE (S256 only).
 *
 * There is no login step: this server fronts a single deployment, so any
 * client that completes the PKCE handshake receives a bearer token for the
 * MCP endpoint.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749">RFC 6749 - OAuth 2.0</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/")
public class AuthorizationResource {

    private static final Logger LOG = Logger.getLogger(AuthorizationResource.class);

    static final String GRANT_TYPE_AUTHORIZATION_CODE = "authorization_code";

    @Inject
    CodeExchangeService exchangeService;

    @Inject
    PkceService pkceService;

    // ==================== Authorization Endpoint ====================

    /**
     * OAuth2 Authorization endpoint.
     *
     * GET /authorize?
     *   response_type=code
     *   &client_id=claude
     *   &redirect_uri=https://client.example.com/callback
     *   &scope=tools
     *   &state=xyz123
     *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
     *   &code_challenge_method=S256
     */
    @GET
    @Path("/authorize")
    public Response authorize(
            @QueryParam("response_type") String responseType,
            @QueryParam("client_id") String clientId,
            @QueryParam("redirect_uri") String redirectUri,
            @QueryParam("scope") String scope,
            @QueryParam("state") String state,
            @QueryParam("code_challenge") String codeChallenge,
            @QueryParam("code_challenge_method") String codeChallengeMethod
    ) {
        require(responseType, "response_type");
        require(clientId, "client_id");
        require(redirectUri, "redirect_uri");
        require(scope, "scope");
        require(state, "state");
        require(codeChallenge, "code_challenge");
        require(codeChallengeMethod, "code_challenge_method");
        requireValidUri(redirectUri);

        if (!"code".equals(responseType)) {
            return errorRedirect(redirectUri, "unsupported_response_type",
                "Only 'code' response type is supported", state);
        }
        if (!pkceService.isSupportedMethod(codeChallengeMethod)) {
            return errorRedirect(redirectUri, "invalid_request",
                "code_challenge_method must be S256", state);
        }

        AuthorizationGrant grant = exchangeService.createGrant(
            clientId, redirectUri, scope, codeChallenge, codeChallengeMethod);

        LOG.debugf("Redirecting client %s to %s", clientId, redirectUri);
        return redirect(redirectUri, "code=" + urlEncode(grant.code()) + "&state=" + urlEncode(state));
    }

    // ==================== Token Endpoint ====================

    /**
     * OAuth2 Token endpoint. Only the authorization_code grant is supported.
     *
     * Failures surface as {@link OAuthException} and are rendered by
     * {@link OAuthExceptionMapper}.
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<Response> token(
            @FormParam("grant_type") String grantType,
            @FormParam("code") String code,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("client_id") String clientId,
            @FormParam("code_verifier") String codeVerifier
    ) {
        require(grantType, "grant_type");
        if (!GRANT_TYPE_AUTHORIZATION_CODE.equals(grantType)) {
            throw new OAuthException.UnsupportedGrantType(grantType);
        }
        require(code, "code");
        require(redirectUri, "redirect_uri");
        require(clientId, "client_id");
        require(codeVerifier, "code_verifier");

        return exchangeService.exchange(code, clientId, redirectUri, codeVerifier)
            .map(issued -> Response.ok(new TokenResponse(issued.accessToken(), "Bearer"))
                .header("Cache-Control", "no-store")
                .build());
    }

    // ==================== Helpers ====================

    private void require(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new OAuthException.InvalidRequest(name + " is required");
        }
    }

    private void requireValidUri(String redirectUri) {
        try {
            new URI(redirectUri);
        } catch (URISyntaxException e) {
            LOG.debugf("Rejected redirect_uri %s: %s", redirectUri, e.getMessage());
            throw new OAuthException.InvalidRequest("redirect_uri is not a valid URI");
        }
    }

    private Response errorRedirect(String redirectUri, String error, String description, String state) {
        StringBuilder query = new StringBuilder();
        query.append("error=").append(urlEncode(error));
        query.append("&error_description=").append(urlEncode(description));
        query.append("&state=").append(urlEncode(state));
        return redirect(redirectUri, query.toString());
    }

    private Response redirect(String redirectUri, String query) {
        String separator = redirectUri.contains("?") ? "&" : "?";
        return Response.status(Response.Status.FOUND)
            .location(URI.create(redirectUri + separator + query))
            .build();
    }

    private String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    // ==================== DTOs ====================

    public record TokenResponse(
        String access_token,
        String token_type
    ) {}
}
