package agents.bridge.mcp.transport;

import agents.bridge.BridgeContext;
import agents.bridge.config.ServerConfig;
import agents.bridge.config.TransportKind;
import agents.bridge.exception.ConnectionException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.core.parsetools.RecordParser;
import io.vertx.ext.web.client.WebClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import static agents.bridge.services.LogUtil.*;

/**
 * Server push over {@code text/event-stream} paired with HTTP POSTs for outbound messages.
 *
 * <p>The stream's first {@code endpoint} event names the URL requests are posted to; the channel
 * counts as open once it arrives. Replies come back as {@code message} events. A reply returned
 * directly in the POST body is accepted as well.</p>
 */
public class EventStreamTransport extends AbstractMcpTransport {

    private static final String ENDPOINT_EVENT = "endpoint";
    private static final String MESSAGE_EVENT = "message";

    private volatile HttpClient client;
    private volatile WebClient webClient;
    private volatile HttpClientResponse stream;
    private volatile String postUrl;

    public EventStreamTransport(BridgeContext ctx, ServerConfig config, JsonRpcSession session) {
        super(ctx, config, session);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.EVENT_STREAM;
    }

    @Override
    protected Future<Void> openChannel() {
        client = ctx.getVertx().createHttpClient(new HttpClientOptions()
            .setConnectTimeout((int) Math.min(Integer.MAX_VALUE, config.getTimeout())));
        webClient = WebClient.create(ctx.getVertx());

        Promise<Void> ready = Promise.promise();
        RequestOptions options = new RequestOptions();
        options.setMethod(HttpMethod.GET);
        options.setAbsoluteURI(config.getUrl());
        options.putHeader("Accept", "text/event-stream");

        client.request(options)
            .compose(req -> req.send())
            .onSuccess(resp -> {
                if (resp.statusCode() != 200) {
                    ready.tryFail(new ConnectionException(config.getId(),
                        "Event stream returned status " + resp.statusCode(), null));
                    resp.request().reset();
                    return;
                }
                stream = resp;
                EventStreamParser events = new EventStreamParser((event, data) -> onEvent(event, data, ready));
                resp.handler(RecordParser.newDelimited("\n",
                    line -> events.handleLine(line.toString(StandardCharsets.UTF_8))));
                resp.endHandler(v -> {
                    ConnectionException ended = new ConnectionException(config.getId(), "Event stream ended", null);
                    ready.tryFail(ended);
                    channelClosed(ended);
                });
                resp.exceptionHandler(err -> {
                    ConnectionException broken = new ConnectionException(config.getId(),
                        "Event stream error: " + err.getMessage(), err);
                    ready.tryFail(broken);
                    channelClosed(broken);
                });
            })
            .onFailure(ready::tryFail);

        return ready.future();
    }

    private void onEvent(String event, String data, Promise<Void> ready) {
        if (ENDPOINT_EVENT.equals(event)) {
            postUrl = URI.create(config.getUrl()).resolve(data.trim()).toString();
            session.attach(this::writeMessage);
            logDetail(ctx, "Event stream ready, posting to " + postUrl, "EventStreamTransport", "Open", config.getId());
            ready.tryComplete();
        } else if (MESSAGE_EVENT.equals(event)) {
            session.handleLine(data);
        } else {
            logDebug(ctx, "Ignoring event " + event, "EventStreamTransport", "Event", config.getId());
        }
    }

    private Future<Void> writeMessage(JsonObject message) {
        WebClient http = webClient;
        String target = postUrl;
        if (http == null || target == null) {
            return Future.failedFuture(new ConnectionException(config.getId(), "Event stream is not open", null));
        }
        return http.postAbs(target)
            .putHeader("Content-Type", "application/json")
            .timeout(config.getTimeout())
            .sendJsonObject(message)
            .compose(resp -> {
                if (resp.statusCode() / 100 != 2) {
                    return Future.failedFuture(new ConnectionException(config.getId(),
                        "POST to " + target + " returned status " + resp.statusCode(), null));
                }
                String body = resp.bodyAsString();
                if (body != null && body.trim().startsWith("{")) {
                    session.handleLine(body);
                }
                return Future.<Void>succeededFuture();
            });
    }

    @Override
    protected Future<Void> closeChannel() {
        HttpClientResponse resp = stream;
        HttpClient httpClient = client;
        WebClient http = webClient;
        stream = null;
        client = null;
        webClient = null;
        postUrl = null;

        if (resp != null) {
            resp.request().reset();
        }
        if (http != null) {
            http.close();
        }
        return httpClient == null ? Future.succeededFuture() : httpClient.close();
    }
}
