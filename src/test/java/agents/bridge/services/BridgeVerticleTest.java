package agents.bridge.services;

import agents.bridge.BridgeContext;
import agents.bridge.config.BridgeConfig;
import agents.bridge.config.LlmProviderConfig;
import agents.bridge.config.RetryPolicy;
import agents.bridge.config.ServerConfig;
import agents.bridge.exception.ConnectionException;
import agents.bridge.exception.LlmProviderException;
import agents.bridge.exception.RequestTimeoutException;
import agents.bridge.exception.RoutingValidationException;
import agents.bridge.exception.ToolNotFoundException;
import agents.bridge.testsupport.ScriptedServer;
import agents.bridge.testsupport.ScriptedTransport;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class BridgeVerticleTest {

    private final Map<String, ScriptedServer> scripts = new LinkedHashMap<>();
    private BridgeVerticle verticle;

    @BeforeEach
    void deploy(Vertx vertx, VertxTestContext testContext) {
        scripts.put("git", new ScriptedServer("git")
            .textTool("git_status", "clean")
            .tool("search", "Search the repository", args -> ScriptedServer.textResult("hit for " + args.getString("query"))));
        scripts.put("filesystem", new ScriptedServer("filesystem").textTool("read_file", "file body"));

        Map<String, ServerConfig> servers = new LinkedHashMap<>();
        for (String id : scripts.keySet()) {
            servers.put(id, ServerConfig.builder(id).command("unused").enabled(true).retryAttempts(1).timeout(2000).build());
        }
        BridgeConfig config = new BridgeConfig(servers, 2000, new RetryPolicy(10, 2, 100), 300000, 30000, 0.3,
            LogUtil.DEBUG, false, 0, LlmProviderConfig.none(), false);
        BridgeContext ctx = new BridgeContext(vertx, LogUtil.DEBUG);
        verticle = new BridgeVerticle(ctx, config, ScriptedTransport.factory(ctx, scripts));
        vertx.deployVerticle(verticle).onComplete(testContext.succeedingThenComplete());
    }

    private static Future<JsonObject> request(Vertx vertx, String address, JsonObject body) {
        return vertx.eventBus().<JsonObject>request(address, body).map(Message::body);
    }

    @Test
    @DisplayName("Queries are answered through the event bus")
    void query(Vertx vertx, VertxTestContext testContext) {
        request(vertx, BridgeVerticle.QUERY_ADDRESS, new JsonObject().put("query", "read config.yml"))
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                assertEquals("file body", reply.getString("content"));
                assertEquals(new JsonArray().add("filesystem:read_file"),
                    reply.getJsonObject("metadata").getJsonArray("toolsCalled"));
                testContext.completeNow();
            })));
    }

    @Test
    void directToolCall(Vertx vertx, VertxTestContext testContext) {
        request(vertx, BridgeVerticle.CALL_TOOL_ADDRESS, new JsonObject()
                .put("server", "git").put("tool", "search").put("arguments", new JsonObject().put("query", "TODO")))
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                assertEquals("git", reply.getString("server"));
                assertEquals("hit for TODO", reply.getJsonArray("content").getJsonObject(0).getString("text"));
                assertFalse(reply.getBoolean("isError"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Failures carry an HTTP-style code")
    void unknownToolFailsWith404(Vertx vertx, VertxTestContext testContext) {
        request(vertx, BridgeVerticle.CALL_TOOL_ADDRESS, new JsonObject().put("server", "git").put("tool", "git_push"))
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                assertTrue(err instanceof ReplyException);
                assertEquals(404, ((ReplyException) err).failureCode());
                testContext.completeNow();
            })));
    }

    @Test
    void missingFieldsFailWith400(Vertx vertx, VertxTestContext testContext) {
        request(vertx, BridgeVerticle.CALL_TOOL_ADDRESS, new JsonObject().put("server", "git"))
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                assertEquals(400, ((ReplyException) err).failureCode());
                testContext.completeNow();
            })));
    }

    @Test
    void health(Vertx vertx, VertxTestContext testContext) {
        request(vertx, BridgeVerticle.HEALTH_ADDRESS, new JsonObject())
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                assertTrue(reply.getBoolean("initialized"));
                assertEquals(2, reply.getJsonArray("connectedServers").size());
                assertTrue(reply.getJsonObject("servers").containsKey("git"));
                assertTrue(reply.getJsonObject("servers").containsKey("filesystem"));
                testContext.completeNow();
            })));
    }

    @Test
    void catalog(Vertx vertx, VertxTestContext testContext) {
        request(vertx, BridgeVerticle.CATALOG_ADDRESS, new JsonObject().put("refresh", true))
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                JsonArray servers = reply.getJsonArray("servers");
                assertEquals(2, servers.size());
                assertEquals("connected", servers.getJsonObject(0).getString("status"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Search only reaches servers that expose a search tool")
    void search(Vertx vertx, VertxTestContext testContext) {
        request(vertx, BridgeVerticle.SEARCH_ADDRESS, new JsonObject().put("query", "README"))
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                assertEquals("README", reply.getString("query"));
                JsonArray results = reply.getJsonArray("results");
                assertFalse(results.isEmpty());
                results.forEach(r -> assertEquals("git", ((JsonObject) r).getString("source")));
                testContext.completeNow();
            })));
    }

    @Test
    void reconnect(Vertx vertx, VertxTestContext testContext) {
        request(vertx, BridgeVerticle.RECONNECT_ADDRESS, new JsonObject().put("server", "filesystem"))
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                assertEquals("filesystem", reply.getString("server"));
                assertTrue(reply.getBoolean("connected"));
                assertEquals(2, scripts.get("filesystem").getOpenAttempts().size());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("New settings replace the server set")
    void settingsUpdate(Vertx vertx, VertxTestContext testContext) {
        JsonObject settings = new JsonObject().put("servers", new JsonObject()
            .put("git", new JsonObject().put("type", "stdio").put("command", "unused").put("enabled", true)
                .put("retryAttempts", 1))
            .put("filesystem", new JsonObject().put("type", "stdio").put("command", "unused").put("enabled", false)));

        request(vertx, BridgeVerticle.SETTINGS_ADDRESS, settings)
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                assertEquals(new JsonArray().add("git"), reply.getJsonArray("connectedServers"));
                assertFalse(verticle.getConnectionManager().isServerConnected("filesystem"));
                testContext.completeNow();
            })));
    }

    @Test
    void invalidSettingsAreRejected(Vertx vertx, VertxTestContext testContext) {
        JsonObject settings = new JsonObject().put("servers", new JsonObject()
            .put("remote", new JsonObject().put("type", "sse").put("enabled", true)));

        request(vertx, BridgeVerticle.SETTINGS_ADDRESS, settings)
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                assertEquals(400, ((ReplyException) err).failureCode());
                assertTrue(verticle.getConnectionManager().isServerConnected("git"));
                testContext.completeNow();
            })));
    }

    @Test
    void failureCodes() {
        assertEquals(400, BridgeVerticle.failureCode(new IllegalArgumentException("x")));
        assertEquals(404, BridgeVerticle.failureCode(new ToolNotFoundException("git", "git_push")));
        assertEquals(400, BridgeVerticle.failureCode(new RoutingValidationException("bad")));
        assertEquals(503, BridgeVerticle.failureCode(new ConnectionException("git", "down", null)));
        assertEquals(504, BridgeVerticle.failureCode(new RequestTimeoutException("git", "slow", null)));
        assertEquals(502, BridgeVerticle.failureCode(new LlmProviderException("nope")));
        assertEquals(500, BridgeVerticle.failureCode(new IllegalStateException("boom")));
    }
}
