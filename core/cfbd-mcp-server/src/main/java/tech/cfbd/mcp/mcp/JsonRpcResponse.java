package tech.cfbd.mcp.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A JSON-RPC 2.0 response. Exactly one of result and error is set.
 */
public record JsonRpcResponse(
    String jsonrpc,
    JsonNode id,
    @JsonInclude(JsonInclude.Include.NON_NULL) Object result,
    @JsonInclude(JsonInclude.Include.NON_NULL) JsonRpcError error
) {

    public static final String VERSION = "2.0";

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    public static JsonRpcResponse ok(JsonNode id, Object result) {
        return new JsonRpcResponse(VERSION, id, result, null);
    }

    public static JsonRpcResponse error(JsonNode id, int code, String message) {
        return new JsonRpcResponse(VERSION, id, null, new JsonRpcError(code, message));
    }

    public boolean hasError() {
        return error != null;
    }

    public record JsonRpcError(int code, String message) {
    }
}
