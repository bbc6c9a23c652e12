package tech.cfbd.mcp.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.cfbd.mcp.cache.ResponseCache;
import tech.cfbd.mcp.upstream.UpstreamException;

import java.util.Map;

/**
 * Runs a tool call: validate the arguments, fetch through the response cache,
 * render the result as text.
 *
 * Never fails. Every outcome, upstream errors included, becomes a
 * {@link ToolResult}.
 */
@Singleton
public class ToolDispatcher {

    private static final Logger LOG = Logger.getLogger(ToolDispatcher.class);

    private final ToolCatalog catalog;
    private final ToolParameterValidator validator;
    private final ResponseCache responseCache;
    private final ObjectMapper objectMapper;

    @Inject
    public ToolDispatcher(ToolCatalog catalog, ToolParameterValidator validator,
                          ResponseCache responseCache, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.validator = validator;
        this.responseCache = responseCache;
        this.objectMapper = objectMapper;
    }

    public Uni<ToolResult> call(String name, JsonNode arguments) {
        if (arguments == null || !arguments.isObject() || arguments.isEmpty()) {
            return Uni.createFrom().item(ToolResult.error("Arguments are required"));
        }

        ToolDefinition tool = catalog.find(name).orElse(null);
        if (tool == null) {
            LOG.warnf("Call to unknown tool %s", name);
            return Uni.createFrom().item(ToolResult.error("Unknown tool: " + name));
        }

        Map<String, Object> params;
        try {
            params = validator.validate(tool, arguments);
        } catch (ToolValidationException e) {
            LOG.debugf("Rejected arguments for %s: %s", name, e.getMessage());
            return Uni.createFrom().item(
                ToolResult.text("Validation error: Parameter validation failed: " + e.getMessage()));
        }

        LOG.infof("Calling tool %s -> %s", name, tool.path());
        return responseCache.fetch(tool.path(), params)
            .map(this::render)
            .onFailure(UpstreamException.class).recoverWithItem(e -> {
                String message = ((UpstreamException) e).error().message();
                LOG.infof("Tool %s returned upstream error: %s", name, message);
                return ToolResult.text(message);
            })
            .onFailure().recoverWithItem(e -> {
                LOG.errorf(e, "Tool %s failed unexpectedly", name);
                return ToolResult.error("Internal error: " + e.getMessage());
            });
    }

    private ToolResult render(JsonNode body) {
        try {
            return ToolResult.text(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize upstream response", e);
        }
    }
}
