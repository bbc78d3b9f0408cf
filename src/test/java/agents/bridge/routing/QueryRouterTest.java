package agents.bridge.routing;

import agents.bridge.BridgeContext;
import agents.bridge.config.BridgeConfig;
import agents.bridge.config.LlmProviderConfig;
import agents.bridge.config.RetryPolicy;
import agents.bridge.config.ServerConfig;
import agents.bridge.mcp.client.ConnectionManager;
import agents.bridge.mcp.client.HealthMonitor;
import agents.bridge.mcp.discovery.ServerCatalog;
import agents.bridge.mcp.discovery.ServerDiscovery;
import agents.bridge.services.LlmAPIService;
import agents.bridge.services.LogUtil;
import agents.bridge.testsupport.FakeLlmServer;
import agents.bridge.testsupport.ScriptedServer;
import agents.bridge.testsupport.ScriptedTransport;
import io.vertx.core.Vertx;
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
class QueryRouterTest {

    private static final ServerCatalog CATALOG = Catalogs.of(
        Catalogs.connected("filesystem", "read_file", "list_directory"),
        Catalogs.connected("git", "git_status", "git_log"));

    private BridgeContext ctx;
    private ConnectionManager connections;
    private ServerDiscovery discovery;
    private final Map<String, ScriptedServer> scripts = new LinkedHashMap<>();

    @BeforeEach
    void setUp(Vertx vertx) {
        ctx = new BridgeContext(vertx, LogUtil.DEBUG);
        Map<String, ServerConfig> servers = new LinkedHashMap<>();
        servers.put("git", ServerConfig.builder("git").command("unused").enabled(true).retryAttempts(1).build());
        BridgeConfig config = new BridgeConfig(servers, 2000, new RetryPolicy(10, 2, 100), 300000, 30000, 0.3,
            LogUtil.DEBUG, false, 0, LlmProviderConfig.none(), false);
        connections = new ConnectionManager(ctx, config, ScriptedTransport.factory(ctx, scripts),
            new HealthMonitor());
        discovery = new ServerDiscovery(ctx, connections, 300000);
        scripts.put("git", new ScriptedServer("git").textTool("git_status", "clean").textTool("git_log", "abc123"));
    }

    private LlmAPIService localLlm(FakeLlmServer server) {
        return new LlmAPIService(ctx, new LlmProviderConfig(LlmProviderConfig.LOCAL, null, "llama3",
            server.baseUrl(), 500, 0.1, 5000));
    }

    @Test
    @DisplayName("A valid LLM answer becomes the plan")
    void llmPlanIsUsed(Vertx vertx, VertxTestContext testContext) {
        FakeLlmServer llmServer = new FakeLlmServer().replying("```json\n{\"intent\":\"Check repository\","
            + "\"selectedServer\":\"git\",\"selectedTool\":\"git_log\",\"parameters\":{\"repo_path\":\".\"},"
            + "\"reasoning\":\"history requested\",\"confidence\":0.85}\n```");

        llmServer.start(vertx)
            .compose(s -> new QueryRouter(ctx, discovery, localLlm(s)).analyzeQuery("what changed lately?", CATALOG))
            .onComplete(testContext.succeeding(plan -> testContext.verify(() -> {
                assertEquals("git", plan.getSelectedServer());
                assertEquals("git_log", plan.getSelectedTool());
                assertEquals(0.85, plan.getConfidence(), 1e-9);
                assertEquals("history requested", plan.getReasoning());

                JsonObject request = llmServer.getRequests().get(0);
                assertEquals("llama3", request.getString("model"));
                String prompt = request.getJsonArray("messages").getJsonObject(0).getString("content");
                assertTrue(prompt.contains("what changed lately?"));
                assertTrue(prompt.contains("git_status"));
                assertNull(llmServer.getHeaders().get(0).get("Authorization"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("An answer naming an unknown server falls back to keyword routing")
    void invalidLlmPlanFallsBack(Vertx vertx, VertxTestContext testContext) {
        FakeLlmServer llmServer = new FakeLlmServer().replying(
            "{\"selectedServer\":\"weather\",\"selectedTool\":\"forecast\",\"confidence\":0.99}");

        llmServer.start(vertx)
            .compose(s -> new QueryRouter(ctx, discovery, localLlm(s)).analyzeQuery("show git status", CATALOG))
            .onComplete(testContext.succeeding(plan -> testContext.verify(() -> {
                assertEquals("git", plan.getSelectedServer());
                assertEquals("git_status", plan.getSelectedTool());
                assertEquals("Fallback heuristic analysis", plan.getReasoning());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Provider errors fall back to keyword routing")
    void providerErrorFallsBack(Vertx vertx, VertxTestContext testContext) {
        FakeLlmServer llmServer = new FakeLlmServer().failing(500, "model overloaded");

        llmServer.start(vertx)
            .compose(s -> new QueryRouter(ctx, discovery, localLlm(s)).analyzeQuery("read notes.txt", CATALOG))
            .onComplete(testContext.succeeding(plan -> testContext.verify(() -> {
                assertEquals(1, llmServer.getRequests().size());
                assertEquals("read_file", plan.getSelectedTool());
                assertEquals("notes.txt", plan.getParameters().getString("path"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Without an LLM the router refreshes the catalog and uses keywords")
    void noLlmUsesFallbackWithFreshCatalog(Vertx vertx, VertxTestContext testContext) {
        QueryRouter router = new QueryRouter(ctx, discovery, null);
        assertFalse(router.isLlmConfigured());

        assertTrue(discovery.getCatalog().isEmpty());
        connections.initialize()
            .compose(v -> router.analyzeQuery("show git history"))
            .onComplete(testContext.succeeding(plan -> testContext.verify(() -> {
                assertEquals("git", plan.getSelectedServer());
                assertEquals("git_log", plan.getSelectedTool());
                assertFalse(discovery.getCatalog().isEmpty());
                testContext.completeNow();
            })));
    }
}
