package agents.bridge.mcp.discovery;

import agents.bridge.BridgeContext;
import agents.bridge.config.ServerConfig;
import agents.bridge.mcp.base.ToolDefinition;
import agents.bridge.mcp.client.ConnectionManager;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static agents.bridge.services.LogUtil.*;

/**
 * Builds the capability catalog from the connected servers.
 *
 * <p>Every pass queries all servers concurrently and swaps in a fresh {@link ServerCatalog};
 * readers holding the previous snapshot are unaffected. A server whose discovery fails is
 * cataloged with status {@code error} and no tools instead of aborting the pass.</p>
 */
public class ServerDiscovery {

    public static final String DISCOVERY_FAILED = "Server discovery failed";

    private static final Map<String, String> DISPLAY_NAMES = Map.of(
        "filesystem", "File System",
        "git", "Git Repository",
        "web-search", "Web Search",
        "brave-search", "Brave Search",
        "memory", "Memory & Knowledge",
        "sequential-thinking", "Sequential Thinking");

    private final BridgeContext ctx;
    private final ConnectionManager connectionManager;
    private final long interval;
    private final AtomicReference<ServerCatalog> catalog = new AtomicReference<>(ServerCatalog.empty());

    private Future<ServerCatalog> inFlight;
    private long timerId = -1;

    public ServerDiscovery(BridgeContext ctx, ConnectionManager connectionManager, long interval) {
        this.ctx = ctx;
        this.connectionManager = connectionManager;
        this.interval = interval;
    }

    /**
     * Schedule a discovery pass every interval. The first pass runs immediately.
     */
    public Future<ServerCatalog> start() {
        if (timerId < 0) {
            timerId = ctx.getVertx().setPeriodic(interval, id -> discoverAllServers()
                .onFailure(err -> logError(ctx, "Periodic discovery failed: " + err.getMessage(),
                    "ServerDiscovery", "Periodic", "Discovery")));
        }
        return discoverAllServers();
    }

    public void stop() {
        if (timerId >= 0) {
            ctx.getVertx().cancelTimer(timerId);
            timerId = -1;
        }
    }

    /** The current snapshot, possibly empty. */
    public ServerCatalog getCatalog() {
        return catalog.get();
    }

    /**
     * Current catalog if it is usable, otherwise a freshly discovered one.
     */
    public Future<ServerCatalog> ensureFresh() {
        ServerCatalog current = catalog.get();
        if (current.isEmpty() || shouldRediscover(current)) {
            return discoverAllServers();
        }
        return Future.succeededFuture(current);
    }

    /**
     * Run one pass. Concurrent callers share the pass already in progress.
     */
    public synchronized Future<ServerCatalog> discoverAllServers() {
        if (inFlight != null && !inFlight.isComplete()) {
            return inFlight;
        }
        logInfo(ctx, "Starting discovery of all MCP servers", "ServerDiscovery", "Discover", "Discovery");

        List<String> connected = connectionManager.getConnectedServers();
        List<Future<ServerCatalogEntry>> passes = new ArrayList<>();
        for (String serverId : connected) {
            passes.add(discoverServer(serverId).recover(err -> {
                logError(ctx, "Failed to discover server " + serverId + ": " + err.getMessage(),
                    "ServerDiscovery", "Discover", serverId);
                return Future.succeededFuture(errorEntry(serverId));
            }));
        }

        inFlight = Future.join(passes).map(cf -> {
            List<ServerCatalogEntry> entries = new ArrayList<>();
            passes.forEach(pass -> entries.add(pass.result()));
            entries.addAll(disconnectedEntries(connected));
            ServerCatalog next = new ServerCatalog(entries, System.currentTimeMillis());
            catalog.set(next);
            logInfo(ctx, "Discovery complete: " + entries.size() + " servers cataloged",
                "ServerDiscovery", "Discover", "Discovery");
            return next;
        });
        return inFlight;
    }

    /**
     * Catalog one connected server: its tools (required) and resources (best effort).
     */
    public Future<ServerCatalogEntry> discoverServer(String serverId) {
        if (!connectionManager.isServerConnected(serverId)) {
            return Future.failedFuture(new IllegalStateException("Server " + serverId + " is not connected"));
        }
        // listTools also refreshes the connection's tool cache used for unknown-tool checks
        Future<List<ToolDefinition>> tools = connectionManager.listTools(serverId)
            .map(list -> list.stream().map(this::catalogTool).toList());
        Future<JsonArray> resources = connectionManager.getResources(serverId)
            .recover(err -> {
                logDebug(ctx, "Could not get resources for " + serverId + ": " + err.getMessage(),
                    "ServerDiscovery", "Resources", serverId);
                return Future.succeededFuture(new JsonArray());
            });

        return Future.all(tools, resources).map(cf -> {
            List<ToolDefinition> toolList = tools.result();
            List<JsonObject> resourceList = resources.result().stream()
                .filter(JsonObject.class::isInstance)
                .map(JsonObject.class::cast)
                .toList();
            logDetail(ctx, "Discovered server " + serverId + " with " + toolList.size() + " tools",
                "ServerDiscovery", "Discover", serverId);
            return new ServerCatalogEntry(serverId, generateServerName(serverId),
                generateServerDescription(serverId, toolList), toolList, resourceList,
                ServerStatus.CONNECTED, System.currentTimeMillis());
        });
    }

    private ToolDefinition catalogTool(ToolDefinition tool) {
        String description = tool.getDescription().isEmpty() ? "No description available" : tool.getDescription();
        JsonObject schema = tool.getInputSchema().isEmpty()
            ? new JsonObject().put("type", "object").put("properties", new JsonObject())
            : tool.getInputSchema();
        return new ToolDefinition(tool.getName(), description, schema,
            ToolExamples.forTool(tool.getName(), description), tool.getServerId());
    }

    private List<ServerCatalogEntry> disconnectedEntries(List<String> connected) {
        Set<String> seen = new HashSet<>(connected);
        List<ServerCatalogEntry> entries = new ArrayList<>();
        for (ServerConfig server : connectionManager.getConfig().getEnabledServers()) {
            if (seen.add(server.getId())) {
                entries.add(new ServerCatalogEntry(server.getId(), generateServerName(server.getId()),
                    "Server is not connected", List.of(), List.of(), ServerStatus.DISCONNECTED,
                    System.currentTimeMillis()));
            }
        }
        return entries;
    }

    private static ServerCatalogEntry errorEntry(String serverId) {
        return new ServerCatalogEntry(serverId, serverId, DISCOVERY_FAILED, List.of(), List.of(),
            ServerStatus.ERROR, System.currentTimeMillis());
    }

    /**
     * Rediscover when the set of connected servers differs from the catalog's, or any entry
     * is older than the interval.
     */
    public boolean shouldRediscover(ServerCatalog last) {
        Set<String> current = new HashSet<>(connectionManager.getConnectedServers());
        Set<String> cataloged = last.getEntries().stream()
            .filter(entry -> entry.getStatus() != ServerStatus.DISCONNECTED)
            .map(ServerCatalogEntry::getServerId)
            .collect(Collectors.toSet());
        if (!current.equals(cataloged)) {
            return true;
        }
        long cutoff = System.currentTimeMillis() - interval;
        return last.getEntries().stream().anyMatch(entry -> entry.getLastUpdated() < cutoff);
    }

    /**
     * Friendly name for well-known servers, otherwise the title-cased id.
     */
    public static String generateServerName(String serverId) {
        String known = DISPLAY_NAMES.get(serverId);
        if (known != null) {
            return known;
        }
        return Arrays.stream(serverId.split("-"))
            .filter(word -> !word.isEmpty())
            .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
            .collect(Collectors.joining(" "));
    }

    public static String generateServerDescription(String serverId, List<ToolDefinition> tools) {
        if (tools.isEmpty()) {
            return "MCP server with no available tools";
        }
        List<String> names = tools.stream().map(ToolDefinition::getName).toList();
        String summary = String.join(", ", names.subList(0, Math.min(3, names.size())))
            + (names.size() > 3 ? " and " + (names.size() - 3) + " more" : "");

        if ("filesystem".equals(serverId)) {
            return "File system operations including " + summary;
        }
        if ("git".equals(serverId)) {
            return "Git repository operations including " + summary;
        }
        return "MCP server providing " + tools.size() + " tools: " + summary;
    }

    public long getInterval() {
        return interval;
    }
}
