package agents.bridge.mcp.transport;

import agents.bridge.BridgeContext;
import agents.bridge.exception.ConnectionException;
import agents.bridge.exception.McpErrorException;
import agents.bridge.exception.ProtocolException;
import agents.bridge.exception.RequestTimeoutException;
import agents.bridge.mcp.base.MCPRequest;
import agents.bridge.mcp.base.MCPResponse;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import static agents.bridge.services.LogUtil.*;

/**
 * JSON-RPC request/response correlation for one connection.
 *
 * <p>Owns the pending-request map. Every entry is removed exactly once, by whichever of
 * reply, timeout, write failure or close gets to it first; the loser finds nothing to remove.
 * Replies are matched by id, so out-of-order delivery is fine.</p>
 */
public class JsonRpcSession {

    private final BridgeContext ctx;
    private final String serverId;
    private final RequestIdSequence ids;
    private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();

    private volatile MessageWriter writer;
    private volatile boolean closed = false;
    private volatile Consumer<JsonObject> notificationHandler;

    public JsonRpcSession(BridgeContext ctx, String serverId, RequestIdSequence ids) {
        this.ctx = ctx;
        this.serverId = serverId;
        this.ids = ids;
    }

    /**
     * Bind the channel outbound messages are written to
     */
    public void attach(MessageWriter writer) {
        this.writer = writer;
    }

    public void setNotificationHandler(Consumer<JsonObject> handler) {
        this.notificationHandler = handler;
    }

    /**
     * Send a request and complete with its {@code result} object.
     * Fails with {@link RequestTimeoutException} when no reply arrives within {@code timeoutMs}.
     */
    public Future<JsonObject> request(String method, JsonObject params, long timeoutMs) {
        MessageWriter out = writer;
        if (closed || out == null) {
            return Future.failedFuture(new ConnectionException(serverId,
                "Connection closed: cannot send " + method, null));
        }

        long id = ids.next();
        Promise<JsonObject> promise = Promise.promise();
        PendingRequest request = new PendingRequest(id, method, promise);
        if (pending.putIfAbsent(id, request) != null) {
            return Future.failedFuture(new ProtocolException(serverId, "Request id collision: " + id, null));
        }

        request.setTimerId(ctx.getVertx().setTimer(Math.max(1, timeoutMs), t -> {
            PendingRequest expired = pending.remove(id);
            if (expired != null) {
                logDetail(ctx, "Request " + method + " (" + id + ") timed out after " + timeoutMs + "ms",
                    "JsonRpcSession", "Timeout", serverId);
                expired.fail(new RequestTimeoutException(serverId,
                    "Request timeout: " + method + " (" + id + ") after " + timeoutMs + "ms", null));
            }
        }));

        logData(ctx, "Sending " + method + " (" + id + ")", "JsonRpcSession", "Request", serverId);
        out.write(MCPRequest.call(id, method, params).toJson()).onFailure(err -> {
            PendingRequest unsent = pending.remove(id);
            if (unsent != null) {
                ctx.getVertx().cancelTimer(unsent.getTimerId());
                unsent.fail(new ConnectionException(serverId, "Failed to send " + method + ": " + err.getMessage(), err));
            }
        });
        return promise.future();
    }

    /**
     * Send a notification; no reply is expected
     */
    public Future<Void> notify(String method, JsonObject params) {
        MessageWriter out = writer;
        if (closed || out == null) {
            return Future.failedFuture(new ConnectionException(serverId,
                "Connection closed: cannot send " + method, null));
        }
        return out.write(MCPRequest.notification(method, params).toJson());
    }

    /**
     * Handle one inbound frame. Frames that do not parse are logged and dropped.
     */
    public void handleLine(String line) {
        if (line == null) {
            return;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        JsonObject message;
        try {
            message = new JsonObject(trimmed);
        } catch (DecodeException | ClassCastException e) {
            logDetail(ctx, "Discarding unparseable frame: " + abbreviate(trimmed),
                "JsonRpcSession", "Parse", serverId);
            return;
        }
        handleMessage(message);
    }

    public void handleMessage(JsonObject message) {
        boolean hasMethod = message.getValue("method") instanceof String;
        Object rawId = message.getValue("id");

        if (!hasMethod && rawId != null && (message.containsKey("result") || message.containsKey("error"))) {
            handleResponse(message, rawId);
        } else if (hasMethod && rawId != null) {
            handleServerRequest(message, rawId);
        } else if (hasMethod) {
            handleNotification(message);
        } else {
            logDetail(ctx, "Discarding unrecognized message: " + abbreviate(message.encode()),
                "JsonRpcSession", "Dispatch", serverId);
        }
    }

    private void handleResponse(JsonObject message, Object rawId) {
        Long id = MCPResponse.parseId(rawId);
        PendingRequest request = id == null ? null : pending.remove(id);
        if (request == null) {
            logDetail(ctx, "No pending request for response id " + rawId, "JsonRpcSession", "Response", serverId);
            return;
        }
        ctx.getVertx().cancelTimer(request.getTimerId());

        MCPResponse response;
        try {
            response = MCPResponse.fromJson(message);
        } catch (RuntimeException e) {
            request.fail(new ProtocolException(serverId,
                "Malformed response to " + request.getMethod() + ": " + e.getMessage(), e));
            return;
        }
        if (response.isError()) {
            request.fail(new McpErrorException(serverId, response.getErrorCode(), response.getErrorMessage()));
        } else {
            request.complete(response.getResult());
        }
    }

    private void handleNotification(JsonObject message) {
        logDebug(ctx, "Notification " + message.getString("method"), "JsonRpcSession", "Notification", serverId);
        Consumer<JsonObject> handler = notificationHandler;
        if (handler != null) {
            handler.accept(message);
        }
    }

    /**
     * Servers may ping the client. Anything else is answered with method-not-found.
     */
    private void handleServerRequest(JsonObject message, Object rawId) {
        MessageWriter out = writer;
        if (out == null || closed) {
            return;
        }
        JsonObject reply = new JsonObject()
            .put("jsonrpc", MCPRequest.JSONRPC_VERSION)
            .put("id", rawId);
        if ("ping".equals(message.getString("method"))) {
            reply.put("result", new JsonObject());
        } else {
            reply.put("error", new JsonObject()
                .put("code", MCPResponse.ErrorCodes.METHOD_NOT_FOUND)
                .put("message", "Method not supported by client: " + message.getString("method")));
        }
        out.write(reply).onFailure(err -> logDetail(ctx, "Failed to answer server request: " + err.getMessage(),
            "JsonRpcSession", "ServerRequest", serverId));
    }

    /**
     * Reject every outstanding request with a connection-closed error and refuse new ones.
     */
    public void close(String reason) {
        closed = true;
        int rejected = 0;
        for (Long id : pending.keySet()) {
            PendingRequest request = pending.remove(id);
            if (request != null) {
                ctx.getVertx().cancelTimer(request.getTimerId());
                request.fail(new ConnectionException(serverId,
                    "Connection closed" + (reason == null ? "" : ": " + reason), null));
                rejected++;
            }
        }
        if (rejected > 0) {
            logDetail(ctx, "Rejected " + rejected + " pending requests on close", "JsonRpcSession", "Close", serverId);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(long id) {
        return pending.containsKey(id);
    }

    public String getServerId() {
        return serverId;
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
