package agents.bridge.mcp.transport;

import agents.bridge.BridgeContext;
import agents.bridge.config.ServerConfig;
import agents.bridge.config.TransportKind;
import agents.bridge.services.LogUtil;
import agents.bridge.testsupport.ScriptedServer;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Event-stream transport against a Vert.x server that announces a POST endpoint and pushes
 * replies back as {@code message} events.
 */
@ExtendWith(VertxExtension.class)
class EventStreamTransportTest {

    private final ScriptedServer script = new ScriptedServer("sse-server")
        .textTool("lookup", "found it");
    private final AtomicReference<HttpServerResponse> stream = new AtomicReference<>();
    private HttpServer server;
    private EventStreamTransport transport;

    @BeforeEach
    void startServer(Vertx vertx, VertxTestContext testContext) {
        Router router = Router.router(vertx);
        router.get("/sse").handler(rc -> {
            HttpServerResponse resp = rc.response()
                .setChunked(true)
                .putHeader("Content-Type", "text/event-stream");
            stream.set(resp);
            resp.write(": connected\n\n");
            resp.write("event: endpoint\ndata: /messages?session=1\n\n");
        });
        router.post("/messages").handler(BodyHandler.create());
        router.post("/messages").handler(rc -> {
            JsonObject reply = script.respond(rc.body().asJsonObject());
            rc.response().setStatusCode(202).end();
            if (reply != null) {
                stream.get().write("event: message\ndata: " + reply.encode() + "\n\n");
            }
        });
        vertx.createHttpServer().requestHandler(router).listen(0)
            .onComplete(testContext.succeeding(s -> {
                server = s;
                testContext.completeNow();
            }));
    }

    @AfterEach
    void stop(VertxTestContext testContext) {
        (transport == null ? server.close() : transport.disconnect().compose(v -> server.close()))
            .onComplete(ar -> testContext.completeNow());
    }

    private void create(Vertx vertx) {
        BridgeContext ctx = new BridgeContext(vertx, LogUtil.DEBUG);
        ServerConfig config = ServerConfig.builder("sse")
            .transport(TransportKind.EVENT_STREAM)
            .url("http://localhost:" + server.actualPort() + "/sse")
            .enabled(true)
            .timeout(5000)
            .build();
        transport = new EventStreamTransport(ctx, config, new JsonRpcSession(ctx, "sse", new RequestIdSequence()));
    }

    @Test
    @DisplayName("Requests are posted to the announced endpoint and replies arrive as events")
    void connectAndCall(Vertx vertx, VertxTestContext testContext) {
        create(vertx);
        transport.connect()
            .compose(v -> transport.listTools())
            .compose(tools -> {
                testContext.verify(() -> assertEquals("lookup", tools.get(0).getName()));
                return transport.callTool("lookup", new JsonObject().put("q", "x"), 5000);
            })
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals("found it", result.textContent());
                assertEquals("sse-server",
                    transport.getServerInfo().getJsonObject("serverInfo").getString("name"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("The stream ending fires the close handler")
    void streamEnds(Vertx vertx, VertxTestContext testContext) {
        create(vertx);
        transport.closeHandler(err -> testContext.verify(() -> {
            assertFalse(transport.isConnected());
            testContext.completeNow();
        }));
        transport.connect().onComplete(testContext.succeeding(v -> stream.get().end()));
    }
}
