package agents.bridge.mcp.client;

import agents.bridge.BridgeContext;
import agents.bridge.config.ServerConfig;
import agents.bridge.exception.ConnectionException;
import agents.bridge.exception.McpErrorException;
import agents.bridge.exception.ToolNotFoundException;
import agents.bridge.mcp.base.ToolDefinition;
import agents.bridge.mcp.base.ToolResult;
import agents.bridge.mcp.transport.JsonRpcSession;
import agents.bridge.mcp.transport.McpTransport;
import agents.bridge.mcp.transport.RequestIdSequence;
import agents.bridge.mcp.transport.TransportFactory;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

import static agents.bridge.services.LogUtil.*;

/**
 * One connection to one server. Owns its transport and the JSON-RPC session holding the
 * pending-request map. A connection is never reused: reconnecting builds a new one.
 */
public class McpConnection {

    public static final String NOTIFICATION_ADDRESS_PREFIX = "mcp.notification.";
    private static final String TOOLS_CHANGED = "notifications/tools/list_changed";

    private final BridgeContext ctx;
    private final ServerConfig config;
    private final JsonRpcSession session;
    private final McpTransport transport;

    private volatile List<ToolDefinition> tools = List.of();

    public McpConnection(BridgeContext ctx, ServerConfig config, RequestIdSequence ids, TransportFactory factory) {
        this.ctx = ctx;
        this.config = config;
        this.session = new JsonRpcSession(ctx, config.getId(), ids);
        this.session.setNotificationHandler(this::handleNotification);
        this.transport = factory.create(config, session);
    }

    /**
     * Connect and load the tool list used to validate calls locally.
     * A server that rejects {@code tools/list} is treated as exposing no tools.
     */
    public Future<Void> connect() {
        return transport.connect()
            .compose(v -> refreshTools()
                .recover(err -> {
                    if (err instanceof McpErrorException) {
                        logDetail(ctx, "Server does not list tools: " + err.getMessage(),
                            "McpConnection", "Connect", config.getId());
                        return Future.succeededFuture(List.of());
                    }
                    return transport.disconnect().transform(ar -> Future.failedFuture(err));
                }))
            .mapEmpty();
    }

    private void handleNotification(JsonObject notification) {
        if (TOOLS_CHANGED.equals(notification.getValue("method")) && transport.isConnected()) {
            refreshTools().onFailure(err -> logDetail(ctx,
                "Tool refresh after list change failed: " + err.getMessage(),
                "McpConnection", "ToolsChanged", config.getId()));
        }
        ctx.getVertx().eventBus().publish(NOTIFICATION_ADDRESS_PREFIX + config.getId(), notification);
    }

    public Future<Void> disconnect() {
        return transport.disconnect();
    }

    /**
     * Call a tool with the server's configured timeout
     */
    public Future<ToolResult> callTool(String name, JsonObject arguments) {
        return callTool(name, arguments, config.getTimeout());
    }

    /**
     * Call a tool. Unknown tool names are rejected before anything is sent.
     */
    public Future<ToolResult> callTool(String name, JsonObject arguments, long timeoutMs) {
        if (!transport.isConnected()) {
            return Future.failedFuture(new ConnectionException(config.getId(),
                "Not connected to server: " + config.getId(), null));
        }
        if (!hasTool(name)) {
            return Future.failedFuture(new ToolNotFoundException(config.getId(), name));
        }
        return transport.callTool(name, arguments, timeoutMs);
    }

    /**
     * Fetch the tool list from the server and refresh the local cache.
     */
    public Future<List<ToolDefinition>> refreshTools() {
        return transport.listTools().onSuccess(list -> tools = list);
    }

    public Future<JsonArray> listResources() {
        return transport.listResources();
    }

    public Future<JsonObject> readResource(String uri) {
        return transport.readResource(uri);
    }

    public Future<JsonObject> callMethod(String method, JsonObject params) {
        return transport.callMethod(method, params, config.getTimeout());
    }

    public boolean hasTool(String name) {
        return tools.stream().anyMatch(tool -> tool.getName().equals(name));
    }

    /** Tools as of the last successful listing. */
    public List<ToolDefinition> getTools() {
        return tools;
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    public void closeHandler(Handler<Throwable> handler) {
        transport.closeHandler(handler);
    }

    public String getServerId() {
        return config.getId();
    }

    public ServerConfig getConfig() {
        return config;
    }

    public JsonObject getServerInfo() {
        return transport.getServerInfo();
    }

    public int pendingRequestCount() {
        return session.pendingCount();
    }

    McpTransport getTransport() {
        return transport;
    }
}
