package tech.cfbd.mcp.tools;

/**
 * Outcome of one tool invocation, rendered to the client as a single text
 * content block.
 *
 * @param text    the text shown to the caller
 * @param isError true when the call itself was malformed (unknown tool, no
 *                arguments). Upstream failures and validation problems are
 *                reported as ordinary text.
 */
public record ToolResult(String text, boolean isError) {

    public static ToolResult text(String text) {
        return new ToolResult(text, false);
    }

    public static ToolResult error(String text) {
        return new ToolResult(text, true);
    }
}
