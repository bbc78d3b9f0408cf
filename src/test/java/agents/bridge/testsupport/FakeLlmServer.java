package agents.bridge.testsupport;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local HTTP server that answers the chat-completion and messages endpoints with a canned reply.
 */
public class FakeLlmServer {

    private final List<JsonObject> requests = new CopyOnWriteArrayList<>();
    private final List<MultiMap> headers = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String reply = "";
    private volatile JsonObject errorBody = new JsonObject();
    private HttpServer server;

    public FakeLlmServer replying(String text) {
        this.status = 200;
        this.reply = text;
        return this;
    }

    public FakeLlmServer failing(int status, String message) {
        this.status = status;
        this.errorBody = new JsonObject().put("error", new JsonObject().put("message", message));
        return this;
    }

    public Future<FakeLlmServer> start(Vertx vertx) {
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());
        router.post("/v1/chat/completions").handler(rc -> {
            record(rc.body().asJsonObject(), rc.request().headers());
            if (status != 200) {
                rc.response().setStatusCode(status).end(errorBody.encode());
                return;
            }
            JsonObject body = new JsonObject().put("choices", new JsonArray()
                .add(new JsonObject().put("message", new JsonObject().put("role", "assistant").put("content", reply))));
            rc.response().putHeader("Content-Type", "application/json").end(body.encode());
        });
        router.post("/v1/messages").handler(rc -> {
            record(rc.body().asJsonObject(), rc.request().headers());
            if (status != 200) {
                rc.response().setStatusCode(status).end(errorBody.encode());
                return;
            }
            JsonObject body = new JsonObject().put("content", new JsonArray()
                .add(new JsonObject().put("type", "text").put("text", reply)));
            rc.response().putHeader("Content-Type", "application/json").end(body.encode());
        });
        return vertx.createHttpServer().requestHandler(router).listen(0).map(s -> {
            server = s;
            return this;
        });
    }

    private void record(JsonObject body, MultiMap requestHeaders) {
        requests.add(body);
        headers.add(MultiMap.caseInsensitiveMultiMap().addAll(requestHeaders));
    }

    public String baseUrl() {
        return "http://localhost:" + server.actualPort();
    }

    public List<JsonObject> getRequests() {
        return requests;
    }

    public List<MultiMap> getHeaders() {
        return headers;
    }
}
