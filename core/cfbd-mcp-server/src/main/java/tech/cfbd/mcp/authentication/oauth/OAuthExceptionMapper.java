package tech.cfbd.mcp.authentication.oauth;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

/**
 * JAX-RS exception mapper for {@link OAuthException}.
 *
 * Response format:
 * <pre>
 * HTTP/1.1 400 Bad Request
 * {
 *   "error": "invalid_grant",
 *   "error_description": "PKCE verification failed",
 *   "detail": "PKCE verification failed"
 * }
 * </pre>
 *
 * {@code detail} repeats the description for clients that read that field.
 */
@Provider
public class OAuthExceptionMapper implements ExceptionMapper<OAuthException> {

    @Override
    public Response toResponse(OAuthException exception) {
        return Response.status(Response.Status.BAD_REQUEST)
            .type(MediaType.APPLICATION_JSON)
            .header("Cache-Control", "no-store")
            .entity(Map.of(
                "error", exception.error(),
                "error_description", exception.getMessage(),
                "detail", exception.getMessage()))
            .build();
    }
}
