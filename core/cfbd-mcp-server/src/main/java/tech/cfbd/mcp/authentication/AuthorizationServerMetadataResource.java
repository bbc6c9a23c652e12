package tech.cfbd.mcp.authentication;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;

import java.util.List;

/**
 * OAuth 2.0 Authorization Server Metadata (RFC 8414).
 * MCP clients fetch this to discover the authorize and token endpoints.
 */
@Path("/.well-known")
@Produces(MediaType.APPLICATION_JSON)
public class AuthorizationServerMetadataResource {

    @Inject
    AuthConfig authConfig;

    @Context
    UriInfo uriInfo;

    @GET
    @Path("/oauth-authorization-server")
    public AuthorizationServerMetadata metadata() {
        String baseUrl = getBaseUrl();
        return new AuthorizationServerMetadata(
            baseUrl,
            baseUrl + "/authorize",
            baseUrl + "/token",
            baseUrl + "/jwks.json",
            List.of("code"),
            List.of("authorization_code"),
            List.of("S256")
        );
    }

    private String getBaseUrl() {
        return authConfig.externalBaseUrl()
            .orElseGet(() -> uriInfo.getBaseUri().toString())
            .replaceAll("/$", "");
    }

    public record AuthorizationServerMetadata(
        String issuer,
        String authorization_endpoint,
        String token_endpoint,
        String jwks_uri,
        List<String> response_types_supported,
        List<String> grant_types_supported,
        List<String> code_challenge_methods_supported
    ) {}
}
