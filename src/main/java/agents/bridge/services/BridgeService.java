package agents.bridge.services;

import agents.bridge.BridgeContext;
import agents.bridge.exception.RoutingValidationException;
import agents.bridge.mcp.client.ConnectionManager;
import agents.bridge.mcp.discovery.ServerCatalog;
import agents.bridge.mcp.discovery.ServerDiscovery;
import agents.bridge.routing.QueryRouter;
import agents.bridge.routing.RoutingPlan;
import agents.bridge.routing.RoutingPlanParser;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.UUID;

import static agents.bridge.services.LogUtil.*;

/**
 * Answers a natural-language query end to end: route it, run the chosen tool and render the
 * tool's text content as an assistant reply.
 *
 * <p>The returned future always succeeds. Failures become reply text so a caller can show them
 * directly; the reply's metadata says whether a tool ran.</p>
 */
public class BridgeService {

    public static final String NO_SERVERS = "No MCP servers are currently connected. Please check your settings.";
    public static final String NOT_UNDERSTOOD = "I could not determine how to help with that.";

    private final BridgeContext ctx;
    private final ConnectionManager connectionManager;
    private final ServerDiscovery discovery;
    private final QueryRouter router;

    public BridgeService(BridgeContext ctx, ConnectionManager connectionManager, ServerDiscovery discovery,
                         QueryRouter router) {
        this.ctx = ctx;
        this.connectionManager = connectionManager;
        this.discovery = discovery;
        this.router = router;
    }

    public Future<JsonObject> processQuery(String query) {
        long start = System.currentTimeMillis();
        if (query == null || query.isBlank()) {
            return Future.succeededFuture(reply("Please enter a query.", start, null, false));
        }

        List<String> connected = connectionManager.getConnectedServers();
        if (connected.isEmpty()) {
            logDetail(ctx, "Query received with no connected servers", "BridgeService", "ProcessQuery", "Bridge");
            return Future.succeededFuture(reply(NO_SERVERS, start, null, false));
        }

        return router.analyzeQuery(query)
            .compose(plan -> execute(plan, connected, start))
            .recover(err -> {
                logError(ctx, "Error processing query", err, "BridgeService", "ProcessQuery", "Bridge");
                return Future.succeededFuture(
                    reply("Sorry, I encountered an error: " + err.getMessage(), start, null, false));
            });
    }

    private Future<JsonObject> execute(RoutingPlan plan, List<String> connected, long start) {
        double threshold = connectionManager.getConfig().getConfidenceThreshold();
        if (!plan.isActionable(threshold)) {
            logDetail(ctx, "Plan below confidence threshold " + threshold + ": " + plan,
                "BridgeService", "ProcessQuery", "Bridge");
            return Future.succeededFuture(reply(NOT_UNDERSTOOD + " Connected servers: " + String.join(", ", connected),
                start, plan, false));
        }

        ServerCatalog catalog = discovery.getCatalog();
        try {
            RoutingPlanParser.validate(plan, catalog);
        } catch (RoutingValidationException e) {
            return Future.failedFuture(e);
        }

        return connectionManager.callTool(plan.getSelectedServer(), plan.getSelectedTool(), plan.getParameters())
            .map(result -> {
                String text = result.textContent();
                if (text.isEmpty()) {
                    text = "No response from server";
                }
                if (result.isError()) {
                    text = "The tool reported an error: " + text;
                }
                return reply(text, start, plan, true);
            });
    }

    private static JsonObject reply(String content, long start, RoutingPlan plan, boolean toolCalled) {
        JsonArray toolsCalled = new JsonArray();
        if (toolCalled && plan != null) {
            toolsCalled.add(plan.getSelectedServer() + ":" + plan.getSelectedTool());
        }
        JsonObject metadata = new JsonObject()
            .put("processingTime", System.currentTimeMillis() - start)
            .put("toolsCalled", toolsCalled);
        if (plan != null) {
            metadata.put("plan", plan.toJson());
        }
        return new JsonObject()
            .put("id", UUID.randomUUID().toString())
            .put("role", "assistant")
            .put("content", content)
            .put("timestamp", System.currentTimeMillis())
            .put("metadata", metadata);
    }
}
