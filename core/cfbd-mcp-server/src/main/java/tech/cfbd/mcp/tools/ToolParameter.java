package tech.cfbd.mcp.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One query parameter accepted by a tool.
 *
 * @param name     parameter name as sent upstream
 * @param type     accepted JSON type
 * @param required whether the call fails without it
 */
public record ToolParameter(String name, ParameterType type, boolean required) {

    public static ToolParameter required(String name, ParameterType type) {
        return new ToolParameter(name, type, true);
    }

    public static ToolParameter optional(String name, ParameterType type) {
        return new ToolParameter(name, type, false);
    }

    public enum ParameterType {
        INTEGER("int", "integer"),
        STRING("str", "string");

        private final String displayName;
        private final String jsonSchemaType;

        ParameterType(String displayName, String jsonSchemaType) {
            this.displayName = displayName;
            this.jsonSchemaType = jsonSchemaType;
        }

        /**
         * Short name used in validation messages.
         */
        public String displayName() {
            return displayName;
        }

        public String jsonSchemaType() {
            return jsonSchemaType;
        }

        public boolean accepts(JsonNode value) {
            return switch (this) {
                case INTEGER -> value.isIntegralNumber();
                case STRING -> value.isTextual();
            };
        }
    }
}
