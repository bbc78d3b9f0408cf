package agents.bridge.routing;

import agents.bridge.BridgeContext;
import agents.bridge.mcp.discovery.ServerCatalog;
import agents.bridge.mcp.discovery.ServerDiscovery;
import agents.bridge.services.LlmAPIService;
import io.vertx.core.Future;

import static agents.bridge.services.LogUtil.*;

/**
 * Turns a natural-language query into a validated {@link RoutingPlan}.
 *
 * <p>With an LLM configured, the catalog and query are rendered into a prompt and the reply is
 * parsed and validated. Any failure along that path (transport, malformed JSON, unknown server or
 * tool) falls back to {@link FallbackRouter}. Analysis itself never fails.</p>
 */
public class QueryRouter {

    private final BridgeContext ctx;
    private final ServerDiscovery discovery;
    private final LlmAPIService llm;
    private final FallbackRouter fallback;

    public QueryRouter(BridgeContext ctx, ServerDiscovery discovery, LlmAPIService llm) {
        this(ctx, discovery, llm, new FallbackRouter());
    }

    public QueryRouter(BridgeContext ctx, ServerDiscovery discovery, LlmAPIService llm, FallbackRouter fallback) {
        this.ctx = ctx;
        this.discovery = discovery;
        this.llm = llm;
        this.fallback = fallback;
    }

    /**
     * Analyze against the current catalog, refreshing it first if it is empty or stale.
     */
    public Future<RoutingPlan> analyzeQuery(String query) {
        logInfo(ctx, "Analyzing query: " + query, "QueryRouter", "Analyze", "Routing");
        return discovery.ensureFresh()
            .recover(err -> {
                logError(ctx, "Catalog refresh failed, using last snapshot: " + err.getMessage(),
                    "QueryRouter", "Analyze", "Routing");
                return Future.succeededFuture(discovery.getCatalog());
            })
            .compose(catalog -> analyzeQuery(query, catalog));
    }

    public Future<RoutingPlan> analyzeQuery(String query, ServerCatalog catalog) {
        if (llm == null || !llm.isConfigured()) {
            return Future.succeededFuture(fallback(query, catalog));
        }
        return llm.complete(RoutingPrompt.build(query, catalog))
            .map(text -> {
                logData(ctx, "LLM routing reply: " + text, "QueryRouter", "Analyze", "Routing");
                return RoutingPlanParser.parse(text, catalog);
            })
            .onSuccess(plan -> logInfo(ctx, "Routed to " + plan.getSelectedServer() + ":" + plan.getSelectedTool()
                + " (confidence: " + plan.getConfidence() + ")", "QueryRouter", "Analyze", "Routing"))
            .recover(err -> {
                logError(ctx, "LLM routing failed, using fallback analysis: " + err.getMessage(),
                    "QueryRouter", "Analyze", "Routing");
                return Future.succeededFuture(fallback(query, catalog));
            });
    }

    private RoutingPlan fallback(String query, ServerCatalog catalog) {
        RoutingPlan plan = fallback.route(query, catalog);
        logDetail(ctx, "Fallback routed to " + (plan.isEmpty() ? "nothing" : plan.getSelectedServer() + ":"
            + plan.getSelectedTool()) + " (confidence: " + plan.getConfidence() + ")",
            "QueryRouter", "Fallback", "Routing");
        return plan;
    }

    public boolean isLlmConfigured() {
        return llm != null && llm.isConfigured();
    }
}
