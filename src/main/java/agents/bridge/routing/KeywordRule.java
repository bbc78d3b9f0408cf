package agents.bridge.routing;

import agents.bridge.mcp.discovery.ServerCatalogEntry;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One deterministic routing rule: trigger words select a server family, then the first
 * matching tool choice that the server actually exposes.
 */
public class KeywordRule {

    private final String intent;
    private final Predicate<ServerCatalogEntry> serverMatcher;
    private final List<String> triggers;
    private final List<ToolChoice> choices;
    private final double confidence;

    public KeywordRule(String intent, Predicate<ServerCatalogEntry> serverMatcher, List<String> triggers,
                       List<ToolChoice> choices, double confidence) {
        this.intent = intent;
        this.serverMatcher = serverMatcher;
        this.triggers = List.copyOf(triggers);
        this.choices = List.copyOf(choices);
        this.confidence = confidence;
    }

    public boolean appliesTo(ServerCatalogEntry entry) {
        return serverMatcher.test(entry);
    }

    public boolean triggeredBy(String lowerQuery) {
        return triggers.stream().anyMatch(lowerQuery::contains);
    }

    /**
     * Plan for the entry if a tool choice fits both the query and the server's tool list.
     */
    public Optional<RoutingPlan> plan(String query, ServerCatalogEntry entry) {
        String lower = query.toLowerCase(Locale.ROOT);
        for (ToolChoice choice : choices) {
            if (choice.matches(lower) && entry.findTool(choice.tool).isPresent()) {
                return Optional.of(new RoutingPlan(intent, entry.getServerId(), choice.tool,
                    choice.parameters.apply(query), "Fallback heuristic analysis", confidence));
            }
        }
        return Optional.empty();
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * A candidate tool. An empty keyword list matches any query.
     */
    public static class ToolChoice {
        private final List<String> keywords;
        private final String tool;
        private final Function<String, JsonObject> parameters;

        public ToolChoice(List<String> keywords, String tool, Function<String, JsonObject> parameters) {
            this.keywords = List.copyOf(keywords);
            this.tool = tool;
            this.parameters = parameters;
        }

        boolean matches(String lowerQuery) {
            return keywords.isEmpty() || keywords.stream().anyMatch(lowerQuery::contains);
        }

        public String getTool() {
            return tool;
        }
    }
}
