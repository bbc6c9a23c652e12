package tech.cfbd.mcp.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A tool exposed to MCP clients: one upstream endpoint plus the parameters it
 * accepts.
 */
public record ToolDefinition(String name, String path, String description, List<ToolParameter> parameters) {

    public ToolDefinition {
        parameters = List.copyOf(parameters);
    }

    public Optional<ToolParameter> parameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }

    /**
     * JSON Schema object describing the tool arguments.
     */
    public Map<String, Object> inputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ToolParameter parameter : parameters) {
            properties.put(parameter.name(), Map.of("type", parameter.type().jsonSchemaType()));
            if (parameter.required()) {
                required.add(parameter.name());
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }
}
