package agents.bridge.mcp.transport;

import agents.bridge.BridgeContext;
import agents.bridge.config.ServerConfig;
import agents.bridge.config.TransportKind;
import agents.bridge.exception.ConnectionException;
import io.vertx.core.Future;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.JsonObject;

import static agents.bridge.services.LogUtil.*;

/**
 * Persistent WebSocket channel. Each text frame carries one JSON-RPC message.
 */
public class SocketTransport extends AbstractMcpTransport {

    private volatile HttpClient client;
    private volatile WebSocket webSocket;

    public SocketTransport(BridgeContext ctx, ServerConfig config, JsonRpcSession session) {
        super(ctx, config, session);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.SOCKET;
    }

    @Override
    protected Future<Void> openChannel() {
        client = ctx.getVertx().createHttpClient(new HttpClientOptions()
            .setConnectTimeout((int) Math.min(Integer.MAX_VALUE, config.getTimeout())));

        WebSocketConnectOptions options = new WebSocketConnectOptions();
        options.setAbsoluteURI(config.getUrl());

        return client.webSocket(options).map(ws -> {
            if (isDisconnecting()) {
                ws.close();
                throw new ConnectionException(config.getId(), "Socket opened after connect was abandoned", null);
            }
            webSocket = ws;
            ws.textMessageHandler(session::handleLine);
            ws.exceptionHandler(err -> channelClosed(
                new ConnectionException(config.getId(), "Socket error: " + err.getMessage(), err)));
            ws.closeHandler(v -> channelClosed(
                new ConnectionException(config.getId(), "Socket closed by server", null)));
            session.attach(this::writeMessage);
            logDetail(ctx, "WebSocket open to " + config.getUrl(), "SocketTransport", "Open", config.getId());
            return null;
        });
    }

    private Future<Void> writeMessage(JsonObject message) {
        WebSocket ws = webSocket;
        if (ws == null || ws.isClosed()) {
            return Future.failedFuture(new ConnectionException(config.getId(), "Socket is not open", null));
        }
        return ws.writeTextMessage(message.encode());
    }

    @Override
    protected Future<Void> closeChannel() {
        WebSocket ws = webSocket;
        HttpClient httpClient = client;
        webSocket = null;
        client = null;

        Future<Void> closed = ws == null || ws.isClosed() ? Future.succeededFuture() : ws.close();
        return closed
            .transform(ar -> {
                if (ar.failed()) {
                    logDebug(ctx, "Error closing socket: " + ar.cause().getMessage(),
                        "SocketTransport", "Close", config.getId());
                }
                return httpClient == null ? Future.<Void>succeededFuture() : httpClient.close();
            });
    }
}
