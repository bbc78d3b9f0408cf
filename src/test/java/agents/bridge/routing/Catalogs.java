package agents.bridge.routing;

import agents.bridge.mcp.base.ToolDefinition;
import agents.bridge.mcp.discovery.ServerCatalog;
import agents.bridge.mcp.discovery.ServerCatalogEntry;
import agents.bridge.mcp.discovery.ServerStatus;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class Catalogs {

    private Catalogs() {
    }

    static ServerCatalogEntry connected(String serverId, String... tools) {
        return entry(serverId, ServerStatus.CONNECTED, tools);
    }

    static ServerCatalogEntry entry(String serverId, ServerStatus status, String... tools) {
        List<ToolDefinition> defs = new ArrayList<>();
        for (String tool : tools) {
            defs.add(new ToolDefinition(tool, "Runs " + tool, new JsonObject(), List.of(), serverId));
        }
        return new ServerCatalogEntry(serverId, serverId, "test server", defs, List.of(), status,
            System.currentTimeMillis());
    }

    static ServerCatalog of(ServerCatalogEntry... entries) {
        return new ServerCatalog(Arrays.asList(entries), System.currentTimeMillis());
    }
}
