package agents.bridge.services;

import agents.bridge.BridgeContext;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;

import java.util.Set;

import static agents.bridge.services.LogUtil.*;

/**
 * Optional HTTP front for the bridge. Each endpoint forwards to the matching
 * {@link BridgeVerticle} event bus address and relays the reply as JSON.
 */
public class BridgeApiVerticle extends AbstractVerticle {

    public static final String READY_ADDRESS = "mcp.bridge.api.ready";

    private static final long REQUEST_TIMEOUT_MS = 120_000;

    private final BridgeContext ctx;
    private final int port;
    private HttpServer httpServer;

    public BridgeApiVerticle(BridgeContext ctx, int port) {
        this.ctx = ctx;
        this.port = port;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        Router router = Router.router(vertx);

        router.route().handler(CorsHandler.create()
            .addOrigin("*")
            .allowedHeaders(Set.of("content-type", "authorization"))
            .allowedMethods(Set.of(HttpMethod.GET, HttpMethod.POST, HttpMethod.OPTIONS)));
        router.route().handler(BodyHandler.create().setBodyLimit(1024 * 1024));

        router.get("/health").handler(rc -> forward(rc, BridgeVerticle.HEALTH_ADDRESS, new JsonObject()));
        router.get("/catalog").handler(rc -> forward(rc, BridgeVerticle.CATALOG_ADDRESS,
            new JsonObject().put("refresh", "true".equals(rc.queryParams().get("refresh")))));
        router.post("/query").handler(rc -> forward(rc, BridgeVerticle.QUERY_ADDRESS, body(rc)));
        router.post("/search").handler(rc -> forward(rc, BridgeVerticle.SEARCH_ADDRESS, body(rc)));
        router.post("/tools/:server/:tool").handler(rc -> forward(rc, BridgeVerticle.CALL_TOOL_ADDRESS,
            new JsonObject()
                .put("server", rc.pathParam("server"))
                .put("tool", rc.pathParam("tool"))
                .put("arguments", body(rc))));
        router.post("/servers/:server/reconnect").handler(rc -> forward(rc, BridgeVerticle.RECONNECT_ADDRESS,
            new JsonObject().put("server", rc.pathParam("server"))));

        router.route().failureHandler(rc -> {
            Throwable failure = rc.failure();
            int status = rc.statusCode() == -1 ? 500 : rc.statusCode();
            if (failure instanceof DecodeException) {
                status = 400;
            }
            sendError(rc, status, failure != null ? failure.getMessage() : "Unknown error");
        });

        httpServer = vertx.createHttpServer(new HttpServerOptions()
            .setPort(port)
            .setCompressionSupported(true));
        httpServer.requestHandler(router).listen()
            .onSuccess(server -> {
                logInfo(ctx, "Bridge HTTP API started on port " + server.actualPort(),
                    "BridgeApiVerticle", "Start", "HTTP");
                vertx.eventBus().publish(READY_ADDRESS, new JsonObject()
                    .put("port", server.actualPort())
                    .put("timestamp", System.currentTimeMillis()));
                startPromise.complete();
            })
            .onFailure(err -> {
                logError(ctx, "Failed to start bridge HTTP API on port " + port, err,
                    "BridgeApiVerticle", "Start", "HTTP");
                startPromise.fail(err);
            });
    }

    /** Port actually bound, useful when configured with 0. */
    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    private static JsonObject body(RoutingContext rc) {
        if (rc.body() == null || rc.body().length() == 0) {
            return new JsonObject();
        }
        return rc.body().asJsonObject();
    }

    private void forward(RoutingContext rc, String address, JsonObject request) {
        logDebug(ctx, rc.request().method() + " " + rc.request().path() + " -> " + address,
            "BridgeApiVerticle", "Request", "HTTP");
        vertx.eventBus().<JsonObject>request(address, request,
                new DeliveryOptions().setSendTimeout(REQUEST_TIMEOUT_MS))
            .onSuccess(reply -> rc.response()
                .putHeader("content-type", "application/json")
                .end(reply.body().encode()))
            .onFailure(err -> {
                int status = 500;
                if (err instanceof ReplyException) {
                    int code = ((ReplyException) err).failureCode();
                    status = code >= 400 && code < 600 ? code : 500;
                }
                sendError(rc, status, err.getMessage());
            });
    }

    private static void sendError(RoutingContext rc, int status, String message) {
        if (rc.response().ended()) {
            return;
        }
        rc.response()
            .setStatusCode(status)
            .putHeader("content-type", "application/json")
            .end(new JsonObject()
                .put("error", new JsonObject()
                    .put("code", status)
                    .put("message", message == null ? "Unknown error" : message))
                .encode());
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (httpServer == null) {
            stopPromise.complete();
            return;
        }
        httpServer.close()
            .onSuccess(v -> {
                logInfo(ctx, "Bridge HTTP API stopped", "BridgeApiVerticle", "Stop", "HTTP");
                stopPromise.complete();
            })
            .onFailure(stopPromise::fail);
    }
}
