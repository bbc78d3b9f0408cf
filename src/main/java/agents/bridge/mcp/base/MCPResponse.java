package agents.bridge.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * A JSON-RPC response received from a tool server.
 * Either a success response with result or an error response.
 */
public class MCPResponse {

    private final long id;
    private final JsonObject result;
    private final JsonObject error;

    private MCPResponse(long id, JsonObject result, JsonObject error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static MCPResponse success(long id, JsonObject result) {
        return new MCPResponse(id, result == null ? new JsonObject() : result, null);
    }

    public static MCPResponse error(long id, int code, String message) {
        return new MCPResponse(id, null, new JsonObject().put("code", code).put("message", message));
    }

    /**
     * Create from an incoming message that carries a numeric id.
     * A non-object result (rare but legal) is wrapped under "value".
     */
    public static MCPResponse fromJson(JsonObject json) {
        Long parsed = parseId(json.getValue("id"));
        if (parsed == null) {
            throw new IllegalArgumentException("Response id is not numeric: " + json.getValue("id"));
        }
        long id = parsed;
        Object error = json.getValue("error");
        if (error != null) {
            JsonObject errorObj = error instanceof JsonObject
                ? (JsonObject) error
                : new JsonObject().put("message", String.valueOf(error));
            return new MCPResponse(id, null, errorObj);
        }
        Object result = json.getValue("result");
        if (result instanceof JsonObject) {
            return new MCPResponse(id, (JsonObject) result, null);
        }
        return new MCPResponse(id, result == null ? new JsonObject() : new JsonObject().put("value", result), null);
    }

    /**
     * Numeric value of a JSON-RPC id, or null when it is absent or not a number.
     * Servers that echo ids as strings are tolerated.
     */
    public static Long parseId(Object id) {
        if (id instanceof Number) {
            return ((Number) id).longValue();
        }
        if (id instanceof String) {
            try {
                return Long.parseLong((String) id);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public long getId() {
        return id;
    }

    public JsonObject getResult() {
        return result;
    }

    public JsonObject getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    public int getErrorCode() {
        if (error == null) {
            return 0;
        }
        Object code = error.getValue("code");
        return code instanceof Number ? ((Number) code).intValue() : ErrorCodes.INTERNAL_ERROR;
    }

    public String getErrorMessage() {
        if (error == null) {
            return null;
        }
        Object message = error.getValue("message");
        return message == null ? "Unknown error" : String.valueOf(message);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", MCPRequest.JSONRPC_VERSION)
            .put("id", id);
        if (isError()) {
            json.put("error", error);
        } else {
            json.put("result", result);
        }
        return json;
    }

    @Override
    public String toString() {
        if (isError()) {
            return "MCPResponse{id=" + id + ", error=" + error + "}";
        }
        return "MCPResponse{id=" + id + ", result=" + result + "}";
    }

    // Standard JSON-RPC error codes
    public static class ErrorCodes {
        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;
    }
}
