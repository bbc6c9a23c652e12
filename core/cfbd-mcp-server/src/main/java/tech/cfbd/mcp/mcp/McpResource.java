package tech.cfbd.mcp.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import tech.cfbd.mcp.authentication.McpProtected;

import java.util.Optional;

/**
 * MCP streamable-HTTP endpoint.
 *
 * <p>Each POST carries one JSON-RPC message. Requests are answered in the
 * response body, either as JSON or as a single SSE {@code message} event
 * when the client accepts {@code text/event-stream}. Notifications and
 * client responses are acknowledged with 202.
 *
 * <p>{@code initialize} opens a session and returns its id in the
 * {@code Mcp-Session-Id} header; every later request must echo it.
 *
 * <p>Bearer-protected: see {@link McpProtected}.
 */
@Path("/mcp")
@McpProtected
public class McpResource {

    private static final Logger LOG = Logger.getLogger(McpResource.class);

    static final String SESSION_HEADER = "Mcp-Session-Id";
    static final String EVENT_STREAM = "text/event-stream";

    @Inject
    McpRequestHandler requestHandler;

    @Inject
    McpSessionManager sessionManager;

    @Inject
    McpConfig config;

    @Inject
    ObjectMapper objectMapper;

    @POST
    @Consumes(MediaType.WILDCARD)
    public Uni<Response> post(
            String body,
            @HeaderParam(SESSION_HEADER) String sessionId,
            @HeaderParam(HttpHeaders.ACCEPT) String accept
    ) {
        JsonNode message;
        try {
            message = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            LOG.debugf("Unparseable MCP message: %s", e.getOriginalMessage());
            return Uni.createFrom().item(reply(Response.Status.BAD_REQUEST,
                JsonRpcResponse.error(null, JsonRpcResponse.PARSE_ERROR, "Parse error"), accept));
        }
        if (message == null || !message.isObject()) {
            return Uni.createFrom().item(reply(Response.Status.BAD_REQUEST,
                JsonRpcResponse.error(null, JsonRpcResponse.INVALID_REQUEST, "Invalid request"), accept));
        }

        boolean hasMethod = message.hasNonNull("method");
        boolean hasId = message.hasNonNull("id");

        // Notifications and responses to server requests
        if (!hasId || !hasMethod) {
            if (!hasMethod && !message.has("result") && !message.has("error")) {
                return Uni.createFrom().item(reply(Response.Status.BAD_REQUEST,
                    JsonRpcResponse.error(message.get("id"), JsonRpcResponse.INVALID_REQUEST, "Invalid request"), accept));
            }
            if (hasMethod) {
                requestHandler.notify(message, sessionManager.find(sessionId).orElse(null));
            }
            return Uni.createFrom().item(Response.accepted().build());
        }

        JsonNode id = message.get("id");
        if ("initialize".equals(message.get("method").asText())) {
            McpSession session = sessionManager.create();
            return requestHandler.handle(message, session)
                .map(response -> {
                    Response.ResponseBuilder builder = replyBuilder(Response.Status.OK, response, accept);
                    return builder.header(SESSION_HEADER, session.getSessionId()).build();
                });
        }

        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(reply(Response.Status.BAD_REQUEST,
                JsonRpcResponse.error(id, JsonRpcResponse.INVALID_REQUEST, "Missing " + SESSION_HEADER + " header"), accept));
        }
        Optional<McpSession> session = sessionManager.find(sessionId);
        if (session.isEmpty()) {
            return Uni.createFrom().item(reply(Response.Status.NOT_FOUND,
                JsonRpcResponse.error(id, JsonRpcResponse.INVALID_REQUEST, "Session not found"), accept));
        }

        return requestHandler.handle(message, session.get())
            .map(response -> replyBuilder(Response.Status.OK, response, accept)
                .header(SESSION_HEADER, sessionId)
                .build());
    }

    /**
     * No server-initiated stream is offered.
     */
    @GET
    public Response stream() {
        return Response.status(Response.Status.METHOD_NOT_ALLOWED)
            .header(HttpHeaders.ALLOW, "POST, DELETE")
            .build();
    }

    @DELETE
    public Response close(@HeaderParam(SESSION_HEADER) String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Response.status(Response.Status.BAD_REQUEST).build();
        }
        if (!sessionManager.remove(sessionId)) {
            return Response.status(Response.Status.NOT_FOUND).build();
        }
        return Response.ok().build();
    }

    private Response reply(Response.Status status, JsonRpcResponse response, String accept) {
        return replyBuilder(status, response, accept).build();
    }

    private Response.ResponseBuilder replyBuilder(Response.Status status, JsonRpcResponse response, String accept) {
        String json;
        try {
            json = objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize JSON-RPC response", e);
        }

        if (wantsEventStream(accept)) {
            // Streamable HTTP uses standard SSE framing with real LF separators.
            String sse = "event: message\n" + "data: " + json + "\n\n";
            return Response.status(status)
                .type(EVENT_STREAM)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .entity(sse);
        }
        return Response.status(status)
            .type(MediaType.APPLICATION_JSON)
            .entity(json);
    }

    private boolean wantsEventStream(String accept) {
        return !config.jsonResponse() && accept != null && accept.contains(EVENT_STREAM);
    }
}
