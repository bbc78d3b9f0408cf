package agents.bridge.mcp.transport;

import agents.bridge.config.TransportKind;
import agents.bridge.mcp.base.ToolDefinition;
import agents.bridge.mcp.base.ToolResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * One live channel to a tool server. Variants differ only in how bytes move;
 * request correlation lives in the {@link JsonRpcSession} they are built with.
 */
public interface McpTransport {

    TransportKind kind();

    /**
     * Open the channel and complete the {@code initialize} handshake.
     * Fails with a ConnectionException if either does not finish within the server timeout.
     */
    Future<Void> connect();

    /** Close the channel. Outstanding requests are rejected. */
    Future<Void> disconnect();

    Future<ToolResult> callTool(String name, JsonObject arguments, long timeoutMs);

    Future<List<ToolDefinition>> listTools();

    Future<JsonArray> listResources();

    Future<JsonObject> readResource(String uri);

    /** Raw JSON-RPC call returning the {@code result} object. */
    Future<JsonObject> callMethod(String method, JsonObject params, long timeoutMs);

    boolean isConnected();

    /** Result of the {@code initialize} call, empty before connect. */
    JsonObject getServerInfo();

    /**
     * Called once when the channel drops without {@link #disconnect()} having been called.
     */
    void closeHandler(Handler<Throwable> handler);
}
