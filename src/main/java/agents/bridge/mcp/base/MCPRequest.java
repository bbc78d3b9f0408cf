package agents.bridge.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * A JSON-RPC 2.0 request or notification in MCP format.
 * Notifications carry no id and expect no reply.
 */
public class MCPRequest {

    public static final String JSONRPC_VERSION = "2.0";

    private final Long id;
    private final String method;
    private final JsonObject params;

    private MCPRequest(Long id, String method, JsonObject params) {
        this.id = id;
        this.method = method;
        this.params = params == null ? new JsonObject() : params;
    }

    public static MCPRequest call(long id, String method, JsonObject params) {
        return new MCPRequest(id, method, params);
    }

    public static MCPRequest notification(String method, JsonObject params) {
        return new MCPRequest(null, method, params);
    }

    public Long getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public JsonObject getParams() {
        return params;
    }

    public boolean isNotification() {
        return id == null;
    }

    /**
     * Convert to JSON for transmission
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject().put("jsonrpc", JSONRPC_VERSION);
        if (id != null) {
            json.put("id", id);
        }
        return json
            .put("method", method)
            .put("params", params);
    }

    /** Single-line wire form, newline terminated. */
    public String toLine() {
        return toJson().encode() + "\n";
    }

    @Override
    public String toString() {
        return "MCPRequest{id=" + id + ", method='" + method + "', params=" + params + "}";
    }
}
