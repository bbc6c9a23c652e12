package tech.cfbd.mcp.common;

import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * JAX-RS filter that logs every incoming request with its headers when
 * {@code cfbd.server.debug} is on.
 *
 * <p>The Authorization header is reduced to its scheme and the first eight
 * characters of the credential.
 *
 * <p>Providers are built during static init, so the configuration is
 * resolved per request.
 */
@Provider
@PreMatching
public class RequestDebugLoggingFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(RequestDebugLoggingFilter.class);

    @Inject
    Instance<ServerConfig> serverConfig;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!LOG.isDebugEnabled() || !serverConfig.get().debug()) {
            return;
        }

        StringBuilder headers = new StringBuilder();
        for (Map.Entry<String, List<String>> header : requestContext.getHeaders().entrySet()) {
            for (String value : header.getValue()) {
                headers.append("\n  ").append(header.getKey()).append(": ");
                headers.append(HttpHeaders.AUTHORIZATION.equalsIgnoreCase(header.getKey()) ? redact(value) : value);
            }
        }
        LOG.debugf("%s %s%s", requestContext.getMethod(), requestContext.getUriInfo().getRequestUri().getPath(), headers);
    }

    static String redact(String authorization) {
        int space = authorization.indexOf(' ');
        if (space < 0) {
            return "[redacted]";
        }
        String scheme = authorization.substring(0, space);
        String credential = authorization.substring(space + 1);
        String prefix = credential.length() <= 8 ? credential : credential.substring(0, 8);
        return scheme + " " + prefix + "...";
    }
}
