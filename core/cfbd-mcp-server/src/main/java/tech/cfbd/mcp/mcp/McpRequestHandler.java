package tech.cfbd.mcp.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.cfbd.mcp.tools.EndpointSchemas;
import tech.cfbd.mcp.tools.PromptCatalog;
import tech.cfbd.mcp.tools.ToolCatalog;
import tech.cfbd.mcp.tools.ToolDefinition;
import tech.cfbd.mcp.tools.ToolDispatcher;
import tech.cfbd.mcp.tools.ToolResult;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON-RPC method router for MCP requests.
 */
@Singleton
public class McpRequestHandler {

    private static final Logger LOG = Logger.getLogger(McpRequestHandler.class);

    static final List<String> SUPPORTED_PROTOCOLS = List.of(
        "2025-06-18",
        "2025-03-26",
        "2024-11-05"
    );

    private final McpConfig config;
    private final ToolCatalog toolCatalog;
    private final ToolDispatcher toolDispatcher;
    private final EndpointSchemas endpointSchemas;
    private final PromptCatalog promptCatalog;

    @Inject
    public McpRequestHandler(McpConfig config, ToolCatalog toolCatalog, ToolDispatcher toolDispatcher,
                             EndpointSchemas endpointSchemas, PromptCatalog promptCatalog) {
        this.config = config;
        this.toolCatalog = toolCatalog;
        this.toolDispatcher = toolDispatcher;
        this.endpointSchemas = endpointSchemas;
        this.promptCatalog = promptCatalog;
    }

    /**
     * Handle one JSON-RPC request (a message with both method and id).
     */
    public Uni<JsonRpcResponse> handle(JsonNode request, McpSession session) {
        JsonNode id = request.get("id");
        String method = request.path("method").asText();
        JsonNode params = request.path("params");

        try {
            switch (method) {
                case "initialize":
                    return item(JsonRpcResponse.ok(id, initialize(params, session)));
                case "ping":
                    return item(JsonRpcResponse.ok(id, Map.of()));
                case "tools/list":
                    return item(JsonRpcResponse.ok(id, Map.of("tools", listTools())));
                case "tools/call":
                    return callTool(id, params);
                case "resources/list":
                    return item(JsonRpcResponse.ok(id, Map.of("resources", endpointSchemas.list())));
                case "resources/read":
                    return item(readResource(id, params));
                case "prompts/list":
                    return item(JsonRpcResponse.ok(id, Map.of("prompts", promptCatalog.all())));
                case "prompts/get":
                    return item(getPrompt(id, params));
                default:
                    LOG.debugf("Unsupported MCP method %s", method);
                    return item(JsonRpcResponse.error(id, JsonRpcResponse.METHOD_NOT_FOUND,
                        "Method not found: " + method));
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "MCP request handling error for %s", method);
            return item(JsonRpcResponse.error(id, JsonRpcResponse.INTERNAL_ERROR,
                e.getMessage() != null ? e.getMessage() : "Internal error"));
        }
    }

    /**
     * Handle a client notification. Nothing is sent back.
     */
    public void notify(JsonNode notification, McpSession session) {
        String method = notification.path("method").asText();
        if ("notifications/initialized".equals(method) && session != null) {
            session.setInitialized(true);
            LOG.debugf("MCP session %s initialized", session.getSessionId());
        }
    }

    private Map<String, Object> initialize(JsonNode params, McpSession session) {
        String requested = params.path("protocolVersion").asText(null);
        String negotiated = requested != null && SUPPORTED_PROTOCOLS.contains(requested)
            ? requested
            : SUPPORTED_PROTOCOLS.get(0);

        JsonNode clientInfo = params.path("clientInfo");
        session.setClientName(clientInfo.path("name").asText(null));
        session.setClientVersion(clientInfo.path("version").asText(null));
        session.setProtocolVersion(negotiated);
        LOG.infof("MCP session %s initialized by %s %s (protocol %s)",
            session.getSessionId(), session.getClientName(), session.getClientVersion(), negotiated);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", negotiated);
        result.put("capabilities", Map.of(
            "tools", Map.of("listChanged", false),
            "resources", Map.of("subscribe", false, "listChanged", false),
            "prompts", Map.of("listChanged", false)
        ));
        result.put("serverInfo", Map.of("name", config.serverName(), "version", config.serverVersion()));
        return result;
    }

    private List<Map<String, Object>> listTools() {
        return toolCatalog.all().stream()
            .map(this::describeTool)
            .collect(Collectors.toList());
    }

    private Map<String, Object> describeTool(ToolDefinition tool) {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("name", tool.name());
        descriptor.put("description", tool.description());
        descriptor.put("inputSchema", tool.inputSchema());
        return descriptor;
    }

    private Uni<JsonRpcResponse> callTool(JsonNode id, JsonNode params) {
        String name = params.path("name").asText(null);
        if (name == null || name.isBlank()) {
            return item(JsonRpcResponse.error(id, JsonRpcResponse.INVALID_PARAMS, "Missing required parameter: name"));
        }
        JsonNode arguments = params.has("arguments") ? params.get("arguments") : MissingNode.getInstance();
        return toolDispatcher.call(name, arguments)
            .map(result -> JsonRpcResponse.ok(id, toolContent(result)));
    }

    private Map<String, Object> toolContent(ToolResult result) {
        return Map.of(
            "content", List.of(Map.of("type", "text", "text", result.text())),
            "isError", result.isError()
        );
    }

    private JsonRpcResponse readResource(JsonNode id, JsonNode params) {
        String uri = params.path("uri").asText(null);
        if (uri == null || uri.isBlank()) {
            return JsonRpcResponse.error(id, JsonRpcResponse.INVALID_PARAMS, "Missing required parameter: uri");
        }
        return endpointSchemas.read(uri)
            .map(text -> JsonRpcResponse.ok(id, Map.of("contents", List.of(Map.of(
                "uri", uri,
                "mimeType", "text/plain",
                "text", text)))))
            .orElseGet(() -> JsonRpcResponse.error(id, JsonRpcResponse.INVALID_PARAMS,
                "Unknown schema URI: " + uri));
    }

    private JsonRpcResponse getPrompt(JsonNode id, JsonNode params) {
        String name = params.path("name").asText(null);
        if (name == null || name.isBlank()) {
            return JsonRpcResponse.error(id, JsonRpcResponse.INVALID_PARAMS, "Missing required parameter: name");
        }
        Map<String, String> arguments = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = params.path("arguments").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            arguments.put(field.getKey(), field.getValue().asText());
        }

        try {
            String text = promptCatalog.render(name, arguments);
            return JsonRpcResponse.ok(id, Map.of("messages", List.of(Map.of(
                "role", "user",
                "content", Map.of("type", "text", "text", text)))));
        } catch (IllegalArgumentException e) {
            return JsonRpcResponse.error(id, JsonRpcResponse.INVALID_PARAMS, e.getMessage());
        }
    }

    private static Uni<JsonRpcResponse> item(JsonRpcResponse response) {
        return Uni.createFrom().item(response);
    }
}
