package tech.cfbd.mcp.tools;

/**
 * Tool arguments do not match the tool's declared parameters.
 */
public class ToolValidationException extends RuntimeException {

    public ToolValidationException(String message) {
        super(message);
    }
}
