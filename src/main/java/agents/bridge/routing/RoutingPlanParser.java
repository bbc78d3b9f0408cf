package agents.bridge.routing;

import agents.bridge.exception.LlmProviderException;
import agents.bridge.exception.RoutingValidationException;
import agents.bridge.mcp.discovery.ServerCatalog;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns the text of an LLM completion into a validated {@link RoutingPlan}.
 */
public final class RoutingPlanParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?[ \\t]*\\r?\\n?");

    private RoutingPlanParser() {
    }

    /**
     * Parse and validate a completion.
     *
     * @throws LlmProviderException if the text holds no JSON object
     * @throws RoutingValidationException if required fields are missing or name an unknown server or tool
     */
    public static RoutingPlan parse(String response, ServerCatalog catalog) {
        JsonObject parsed = extractJson(response);

        String server = parsed.getValue("selectedServer") instanceof String ? parsed.getString("selectedServer") : null;
        String tool = parsed.getValue("selectedTool") instanceof String ? parsed.getString("selectedTool") : null;
        if (server == null || server.isBlank() || tool == null || tool.isBlank()) {
            throw new RoutingValidationException("Invalid LLM response: missing required fields");
        }

        List<RoutingPlan> fallbacks = new ArrayList<>();
        Object rawFallbacks = parsed.getValue("fallbackOptions");
        if (rawFallbacks instanceof JsonArray) {
            for (Object option : (JsonArray) rawFallbacks) {
                if (option instanceof JsonObject) {
                    RoutingPlan candidate = toPlan((JsonObject) option, List.of());
                    if (isValid(candidate, catalog)) {
                        fallbacks.add(candidate);
                    }
                }
            }
        }

        RoutingPlan plan = toPlan(parsed, fallbacks);
        validate(plan, catalog);
        return plan;
    }

    /**
     * Reject a plan whose server or tool is not in the snapshot, whatever its confidence.
     */
    public static void validate(RoutingPlan plan, ServerCatalog catalog) {
        if (plan.isEmpty()) {
            throw new RoutingValidationException("Routing plan names no server or tool");
        }
        if (catalog.getEntry(plan.getSelectedServer()).isEmpty()) {
            throw new RoutingValidationException("Invalid server: " + plan.getSelectedServer());
        }
        if (!catalog.hasTool(plan.getSelectedServer(), plan.getSelectedTool())) {
            throw new RoutingValidationException(
                "Tool " + plan.getSelectedTool() + " not found on server " + plan.getSelectedServer());
        }
    }

    public static boolean isValid(RoutingPlan plan, ServerCatalog catalog) {
        try {
            validate(plan, catalog);
            return true;
        } catch (RoutingValidationException e) {
            return false;
        }
    }

    /**
     * Strip code fences and any prose around the outermost JSON object.
     */
    static JsonObject extractJson(String response) {
        if (response == null || response.isBlank()) {
            throw new LlmProviderException("Failed to parse LLM response: empty completion");
        }
        String clean = CODE_FENCE.matcher(response).replaceAll("").trim();
        int start = clean.indexOf('{');
        int end = clean.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new LlmProviderException("Failed to parse LLM response: no JSON object found");
        }
        try {
            return new JsonObject(clean.substring(start, end + 1));
        } catch (DecodeException e) {
            throw new LlmProviderException("Failed to parse LLM response: " + e.getMessage(), e);
        }
    }

    private static RoutingPlan toPlan(JsonObject json, List<RoutingPlan> fallbacks) {
        return new RoutingPlan(
            stringOr(json.getValue("intent"), "Unknown intent"),
            stringOr(json.getValue("selectedServer"), ""),
            stringOr(json.getValue("selectedTool"), ""),
            parameters(json.getValue("parameters")),
            stringOr(json.getValue("reasoning"), "No reasoning provided"),
            confidence(json.getValue("confidence")),
            fallbacks);
    }

    private static String stringOr(Object value, String fallback) {
        return value instanceof String && !((String) value).isBlank() ? (String) value : fallback;
    }

    private static JsonObject parameters(Object value) {
        if (value instanceof JsonObject) {
            return (JsonObject) value;
        }
        if (value instanceof String) {
            try {
                return new JsonObject((String) value);
            } catch (DecodeException | ClassCastException e) {
                return new JsonObject();
            }
        }
        return new JsonObject();
    }

    private static double confidence(Object value) {
        if (value instanceof Number) {
            return RoutingPlan.clamp(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            try {
                return RoutingPlan.clamp(Double.parseDouble(((String) value).trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
