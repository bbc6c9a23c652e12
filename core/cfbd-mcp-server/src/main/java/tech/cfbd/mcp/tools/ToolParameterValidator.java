package tech.cfbd.mcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks tool arguments against a {@link ToolDefinition} and converts them to
 * upstream query parameters.
 *
 * Arguments are checked in the order given, then required parameters are
 * checked for presence. The first problem found is reported. Optional
 * parameters passed as null are dropped.
 */
@ApplicationScoped
public class ToolParameterValidator {

    static final String CLASSIFICATION = "classification";
    static final List<String> VALID_DIVISIONS = List.of("fbs", "fcs", "ii", "iii");

    /**
     * @return query parameters in argument order
     * @throws ToolValidationException describing the first invalid argument
     */
    public Map<String, Object> validate(ToolDefinition tool, JsonNode arguments) {
        Map<String, Object> validated = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = arguments.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            ToolParameter parameter = tool.parameter(key)
                .orElseThrow(() -> new ToolValidationException("Unexpected parameter: " + key));

            if (value == null || value.isNull()) {
                if (parameter.required()) {
                    throw typeMismatch(parameter);
                }
                continue;
            }

            if (!parameter.type().accepts(value)) {
                throw typeMismatch(parameter);
            }

            if (CLASSIFICATION.equals(key)) {
                String division = value.asText().toLowerCase();
                if (!VALID_DIVISIONS.contains(division)) {
                    throw new ToolValidationException(
                        "Invalid Classification: Must be one of: " + String.join(", ", VALID_DIVISIONS));
                }
                validated.put(key, division);
                continue;
            }

            validated.put(key, convert(parameter, value));
        }

        for (ToolParameter parameter : tool.parameters()) {
            if (parameter.required() && !arguments.has(parameter.name())) {
                throw new ToolValidationException("Missing required parameter: " + parameter.name());
            }
        }

        return validated;
    }

    private Object convert(ToolParameter parameter, JsonNode value) {
        return switch (parameter.type()) {
            case INTEGER -> value.canConvertToLong() ? (Object) value.longValue() : value.bigIntegerValue();
            case STRING -> value.textValue();
        };
    }

    private ToolValidationException typeMismatch(ToolParameter parameter) {
        return new ToolValidationException(
            "Parameter " + parameter.name() + " must be of type " + parameter.type().displayName());
    }
}
