package agents.bridge.mcp.discovery;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Optional;

/**
 * Immutable catalog snapshot. Discovery builds a new one per pass and swaps it in whole.
 */
public class ServerCatalog {

    private static final ServerCatalog EMPTY = new ServerCatalog(List.of(), 0);

    private final List<ServerCatalogEntry> entries;
    private final long createdAt;

    public ServerCatalog(List<ServerCatalogEntry> entries, long createdAt) {
        this.entries = List.copyOf(entries);
        this.createdAt = createdAt;
    }

    public static ServerCatalog empty() {
        return EMPTY;
    }

    public List<ServerCatalogEntry> getEntries() {
        return entries;
    }

    public List<ServerCatalogEntry> getConnectedEntries() {
        return entries.stream().filter(ServerCatalogEntry::isConnected).toList();
    }

    public Optional<ServerCatalogEntry> getEntry(String serverId) {
        return entries.stream().filter(entry -> entry.getServerId().equals(serverId)).findFirst();
    }

    /**
     * True if the server is connected in this snapshot and lists the tool.
     */
    public boolean hasTool(String serverId, String toolName) {
        return getEntry(serverId)
            .filter(ServerCatalogEntry::isConnected)
            .flatMap(entry -> entry.findTool(toolName))
            .isPresent();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public boolean isOlderThan(long intervalMs, long now) {
        return now - createdAt > intervalMs;
    }

    public JsonObject toJson() {
        JsonArray servers = new JsonArray();
        entries.forEach(entry -> servers.add(entry.toJson()));
        return new JsonObject()
            .put("servers", servers)
            .put("createdAt", createdAt);
    }
}
