package tech.cfbd.mcp.authentication;

import jakarta.annotation.Priority;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.cfbd.mcp.authentication.token.SessionRegistry;
import tech.cfbd.mcp.authentication.token.TokenStore;

/**
 * JAX-RS filter that admits requests to {@link McpProtected} resources only
 * when they carry a bearer token present in the {@link TokenStore}.
 *
 * Runs at {@link Priorities#AUTHENTICATION}, ahead of any MCP session
 * handling, so an unauthenticated request never reaches the transport.
 * The stores are looked up per request because providers are built during
 * static init, before the token file may be read.
 */
@Provider
@McpProtected
@Priority(Priorities.AUTHENTICATION)
public class BearerTokenFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(BearerTokenFilter.class);

    static final String BEARER_PREFIX = "Bearer ";
    static final String MISSING_HEADER = "Unauthorized: Missing or invalid header";
    static final String UNKNOWN_TOKEN = "Unauthorized: Token not recognized";

    @Inject
    Instance<TokenStore> tokenStore;

    @Inject
    Instance<SessionRegistry> sessionRegistry;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        String authHeader = requestContext.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            LOG.warnf("Rejected %s %s: missing or malformed Authorization header",
                requestContext.getMethod(), requestContext.getUriInfo().getPath());
            requestContext.abortWith(unauthorized(MISSING_HEADER));
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length());
        if (!tokenStore.get().contains(token)) {
            LOG.warnf("Rejected unrecognized token %s...", prefix(token));
            requestContext.abortWith(unauthorized(UNKNOWN_TOKEN));
            return;
        }

        LOG.infof("Valid token accepted: %s...", prefix(token));
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Full token: %s (session %s)", token, sessionRegistry.get().sessionFor(token).orElse("none"));
        }
    }

    private Response unauthorized(String message) {
        return Response.status(Response.Status.UNAUTHORIZED)
            .type(MediaType.TEXT_PLAIN)
            .entity(message)
            .build();
    }

    static String prefix(String token) {
        return token.length() <= 8 ? token : token.substring(0, 8);
    }
}
