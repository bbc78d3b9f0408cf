package agents.bridge.mcp.discovery;

import agents.bridge.mcp.base.ToolDefinition;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Optional;

/**
 * What one server offers, as of {@link #getLastUpdated()}.
 */
public class ServerCatalogEntry {

    private final String serverId;
    private final String name;
    private final String description;
    private final List<ToolDefinition> tools;
    private final List<JsonObject> resources;
    private final ServerStatus status;
    private final long lastUpdated;

    public ServerCatalogEntry(String serverId, String name, String description, List<ToolDefinition> tools,
                              List<JsonObject> resources, ServerStatus status, long lastUpdated) {
        this.serverId = serverId;
        this.name = name;
        this.description = description;
        this.tools = tools == null ? List.of() : List.copyOf(tools);
        this.resources = resources == null ? List.of() : resources.stream().map(JsonObject::copy).toList();
        this.status = status;
        this.lastUpdated = lastUpdated;
    }

    public String getServerId() {
        return serverId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<ToolDefinition> getTools() {
        return tools;
    }

    /** Copies, so callers cannot alter the snapshot. */
    public List<JsonObject> getResources() {
        return resources.stream().map(JsonObject::copy).toList();
    }

    public ServerStatus getStatus() {
        return status;
    }

    public long getLastUpdated() {
        return lastUpdated;
    }

    public boolean isConnected() {
        return status == ServerStatus.CONNECTED;
    }

    public Optional<ToolDefinition> findTool(String toolName) {
        return tools.stream().filter(tool -> tool.getName().equals(toolName)).findFirst();
    }

    public JsonObject toJson() {
        JsonArray toolsJson = new JsonArray();
        tools.forEach(tool -> toolsJson.add(tool.toJson()));
        JsonArray resourcesJson = new JsonArray();
        resources.forEach(resource -> resourcesJson.add(resource.copy()));
        return new JsonObject()
            .put("serverId", serverId)
            .put("name", name)
            .put("description", description)
            .put("tools", toolsJson)
            .put("resources", resourcesJson)
            .put("status", status.jsonValue())
            .put("lastUpdated", lastUpdated);
    }
}
