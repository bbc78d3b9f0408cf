package agents.bridge.routing;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * The router's decision: which tool on which server should answer a query, with what arguments.
 * A plan must be validated against the current catalog before it is executed.
 */
public class RoutingPlan {

    private final String intent;
    private final String selectedServer;
    private final String selectedTool;
    private final JsonObject parameters;
    private final String reasoning;
    private final double confidence;
    private final List<RoutingPlan> fallbackOptions;

    public RoutingPlan(String intent, String selectedServer, String selectedTool, JsonObject parameters,
                       String reasoning, double confidence, List<RoutingPlan> fallbackOptions) {
        this.intent = intent;
        this.selectedServer = selectedServer == null ? "" : selectedServer;
        this.selectedTool = selectedTool == null ? "" : selectedTool;
        this.parameters = parameters == null ? new JsonObject() : parameters.copy();
        this.reasoning = reasoning;
        this.confidence = clamp(confidence);
        this.fallbackOptions = fallbackOptions == null ? List.of() : List.copyOf(fallbackOptions);
    }

    public RoutingPlan(String intent, String selectedServer, String selectedTool, JsonObject parameters,
                       String reasoning, double confidence) {
        this(intent, selectedServer, selectedTool, parameters, reasoning, confidence, List.of());
    }

    /**
     * A zero-confidence plan naming no server, used when nothing can handle the query.
     */
    public static RoutingPlan none(String reasoning) {
        return new RoutingPlan("Unknown", "", "", new JsonObject(), reasoning, 0);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(1, value));
    }

    public String getIntent() {
        return intent;
    }

    public String getSelectedServer() {
        return selectedServer;
    }

    public String getSelectedTool() {
        return selectedTool;
    }

    public JsonObject getParameters() {
        return parameters.copy();
    }

    public String getReasoning() {
        return reasoning;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<RoutingPlan> getFallbackOptions() {
        return fallbackOptions;
    }

    public boolean isEmpty() {
        return selectedServer.isEmpty() || selectedTool.isEmpty();
    }

    /**
     * Whether the plan is confident enough to execute rather than ask for clarification.
     */
    public boolean isActionable(double threshold) {
        return !isEmpty() && confidence >= threshold;
    }

    public JsonObject toJson() {
        JsonArray fallbacks = new JsonArray();
        fallbackOptions.forEach(plan -> fallbacks.add(plan.toJson()));
        return new JsonObject()
            .put("intent", intent)
            .put("selectedServer", selectedServer)
            .put("selectedTool", selectedTool)
            .put("parameters", parameters.copy())
            .put("reasoning", reasoning)
            .put("confidence", confidence)
            .put("fallbackOptions", fallbacks);
    }

    @Override
    public String toString() {
        return "RoutingPlan{" + selectedServer + ":" + selectedTool + ", confidence=" + confidence + "}";
    }
}
