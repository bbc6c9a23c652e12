package tech.cfbd.mcp.common;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Liveness text and crawler exclusion. Unauthenticated.
 */
@Path("/")
@Produces(MediaType.TEXT_PLAIN)
public class RootResource {

    static final String ROBOTS_TXT = "User-agent: *\nDisallow: /";

    @GET
    public String root() {
        return "OK";
    }

    @GET
    @Path("/robots.txt")
    public String robots() {
        return ROBOTS_TXT;
    }
}
