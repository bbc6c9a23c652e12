package tech.cfbd.mcp.authentication;

import jakarta.ws.rs.NameBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marker annotation for JAX-RS resources and methods that require a bearer
 * token issued by this server's token endpoint.
 *
 * Requests without a recognized token are rejected with 401 before the
 * resource method runs.
 *
 * @see BearerTokenFilter
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface McpProtected {
}
