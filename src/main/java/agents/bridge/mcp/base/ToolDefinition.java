package agents.bridge.mcp.base;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * A tool exposed by a server: name, description, input schema, example phrases and owning server.
 */
public class ToolDefinition {

    private final String name;
    private final String description;
    private final JsonObject inputSchema;
    private final List<String> examples;
    private final String serverId;

    public ToolDefinition(String name, String description, JsonObject inputSchema,
                          List<String> examples, String serverId) {
        this.name = name;
        this.description = description == null ? "" : description;
        this.inputSchema = inputSchema == null ? new JsonObject() : inputSchema;
        this.examples = examples == null ? List.of() : List.copyOf(examples);
        this.serverId = serverId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonObject getInputSchema() {
        return inputSchema;
    }

    public List<String> getExamples() {
        return examples;
    }

    public String getServerId() {
        return serverId;
    }

    public ToolDefinition withExamples(List<String> newExamples) {
        return new ToolDefinition(name, description, inputSchema, newExamples, serverId);
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("inputSchema", inputSchema)
            .put("examples", new JsonArray(examples))
            .put("serverId", serverId);
    }

    /**
     * Create from one entry of a {@code tools/list} result.
     */
    public static ToolDefinition fromJson(JsonObject json, String serverId) {
        Object exampleArray = json.getValue("examples");
        List<String> examples = exampleArray instanceof JsonArray
            ? ((JsonArray) exampleArray).stream().map(String::valueOf).toList()
            : List.of();
        Object description = json.getValue("description");
        Object schema = json.getValue("inputSchema");
        return new ToolDefinition(
            String.valueOf(json.getValue("name")),
            description instanceof String ? (String) description : null,
            schema instanceof JsonObject ? (JsonObject) schema : null,
            examples,
            serverId);
    }

    @Override
    public String toString() {
        return "ToolDefinition{name='" + name + "', serverId='" + serverId + "'}";
    }
}
