package agents.bridge.mcp.transport;

import agents.bridge.BridgeContext;
import agents.bridge.config.ServerConfig;
import agents.bridge.exception.BridgeException;
import agents.bridge.exception.ConnectionException;
import agents.bridge.mcp.base.ToolDefinition;
import agents.bridge.mcp.base.ToolResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static agents.bridge.services.LogUtil.*;

/**
 * Shared lifecycle for every transport variant: handshake, MCP method calls over the session,
 * and close bookkeeping. Subclasses only open and close their channel and attach a writer.
 */
public abstract class AbstractMcpTransport implements McpTransport {

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String CLIENT_NAME = "mcp-bridge";
    public static final String CLIENT_VERSION = "0.1.1";

    protected final BridgeContext ctx;
    protected final ServerConfig config;
    protected final JsonRpcSession session;

    private final AtomicBoolean channelOpen = new AtomicBoolean(false);
    private volatile boolean connected = false;
    private volatile boolean disconnecting = false;
    private volatile Handler<Throwable> closeHandler;
    private volatile JsonObject serverInfo = new JsonObject();

    protected AbstractMcpTransport(BridgeContext ctx, ServerConfig config, JsonRpcSession session) {
        this.ctx = ctx;
        this.config = config;
        this.session = session;
    }

    /**
     * Open the underlying channel and {@link JsonRpcSession#attach attach} a writer to the session.
     */
    protected abstract Future<Void> openChannel();

    /**
     * Release the underlying channel. Must tolerate being called after a failed open.
     */
    protected abstract Future<Void> closeChannel();

    @Override
    public Future<Void> connect() {
        if (connected) {
            return Future.succeededFuture();
        }
        logDetail(ctx, "Connecting via " + kind(), "Transport", "Connect", config.getId());

        return withTimeout(openChannel(), config.getTimeout(), "Timed out opening channel")
            .compose(v -> {
                channelOpen.set(true);
                return handshake();
            })
            .compose(
                v -> {
                    connected = true;
                    logInfo(ctx, "Connected to " + config.getId() + " via " + kind(),
                        "Transport", "Connect", config.getId());
                    return Future.<Void>succeededFuture();
                },
                err -> {
                    ConnectionException failure = err instanceof ConnectionException
                        ? (ConnectionException) err
                        : new ConnectionException(config.getId(),
                            "Failed to connect to " + config.getId() + ": " + err.getMessage(), err);
                    disconnecting = true;
                    session.close("connect failed");
                    return closeChannel()
                        .transform(ar -> Future.<Void>failedFuture(failure));
                });
    }

    private Future<Void> handshake() {
        JsonObject params = new JsonObject()
            .put("protocolVersion", PROTOCOL_VERSION)
            .put("capabilities", new JsonObject()
                .put("tools", new JsonObject())
                .put("resources", new JsonObject()))
            .put("clientInfo", new JsonObject()
                .put("name", CLIENT_NAME)
                .put("version", CLIENT_VERSION));

        return session.request("initialize", params, config.getTimeout())
            .recover(err -> Future.failedFuture(err instanceof ConnectionException
                ? err
                : new ConnectionException(config.getId(), "Handshake failed: " + err.getMessage(), err)))
            .compose(result -> {
                serverInfo = result;
                return session.notify("notifications/initialized", new JsonObject());
            });
    }

    @Override
    public Future<Void> disconnect() {
        disconnecting = true;
        connected = false;
        session.close("disconnected");
        if (channelOpen.getAndSet(false)) {
            logDetail(ctx, "Disconnecting " + config.getId(), "Transport", "Disconnect", config.getId());
        }
        return closeChannel();
    }

    /**
     * Called by subclasses when the channel drops on its own (process exit, socket close, stream end).
     * Safe to call more than once.
     */
    protected void channelClosed(Throwable cause) {
        boolean wasConnected = connected;
        connected = false;
        session.close(cause == null ? "channel closed" : cause.getMessage());
        if (disconnecting || !channelOpen.getAndSet(false)) {
            return;
        }
        logError(ctx, "Connection to " + config.getId() + " lost: " + (cause == null ? "closed" : cause.getMessage()),
            "Transport", "ChannelClosed", config.getId());
        Handler<Throwable> handler = closeHandler;
        if (handler != null && wasConnected) {
            handler.handle(cause == null
                ? new ConnectionException(config.getId(), "Connection closed", null)
                : cause);
        }
    }

    @Override
    public Future<ToolResult> callTool(String name, JsonObject arguments, long timeoutMs) {
        JsonObject params = new JsonObject()
            .put("name", name)
            .put("arguments", arguments == null ? new JsonObject() : arguments);
        return callMethod("tools/call", params, timeoutMs).map(ToolResult::fromJson);
    }

    @Override
    public Future<List<ToolDefinition>> listTools() {
        return callMethod("tools/list", new JsonObject(), config.getTimeout())
            .map(result -> {
                Object raw = result.getValue("tools");
                if (!(raw instanceof JsonArray)) {
                    logDetail(ctx, "Server " + config.getId() + " returned invalid tools response",
                        "Transport", "ListTools", config.getId());
                    return List.<ToolDefinition>of();
                }
                return ((JsonArray) raw).stream()
                    .filter(JsonObject.class::isInstance)
                    .map(JsonObject.class::cast)
                    .filter(tool -> tool.getValue("name") instanceof String)
                    .map(tool -> ToolDefinition.fromJson(tool, config.getId()))
                    .toList();
            });
    }

    @Override
    public Future<JsonArray> listResources() {
        return callMethod("resources/list", new JsonObject(), config.getTimeout())
            .map(result -> result.getJsonArray("resources", new JsonArray()));
    }

    @Override
    public Future<JsonObject> readResource(String uri) {
        return callMethod("resources/read", new JsonObject().put("uri", uri), config.getTimeout());
    }

    @Override
    public Future<JsonObject> callMethod(String method, JsonObject params, long timeoutMs) {
        if (!connected) {
            return Future.failedFuture(new ConnectionException(config.getId(),
                "Server " + config.getId() + " is not connected", null));
        }
        return session.request(method, params, timeoutMs);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public JsonObject getServerInfo() {
        return serverInfo;
    }

    @Override
    public void closeHandler(Handler<Throwable> handler) {
        this.closeHandler = handler;
    }

    public ServerConfig getConfig() {
        return config;
    }

    /** True once disconnect (or a failed connect) has started tearing the channel down. */
    protected boolean isDisconnecting() {
        return disconnecting;
    }

    /**
     * Race a future against a timer, failing with a ConnectionException on expiry.
     */
    protected <T> Future<T> withTimeout(Future<T> future, long timeoutMs, String message) {
        Promise<T> promise = Promise.promise();
        long timerId = ctx.getVertx().setTimer(Math.max(1, timeoutMs), t ->
            promise.tryFail(new ConnectionException(config.getId(), message + " after " + timeoutMs + "ms", null)));
        future.onComplete(ar -> {
            ctx.getVertx().cancelTimer(timerId);
            if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                Throwable cause = ar.cause();
                promise.tryFail(cause instanceof BridgeException
                    ? cause
                    : new ConnectionException(config.getId(), cause.getMessage(), cause));
            }
        });
        return promise.future();
    }
}
