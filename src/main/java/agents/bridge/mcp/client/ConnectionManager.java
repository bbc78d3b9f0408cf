package agents.bridge.mcp.client;

import agents.bridge.BridgeContext;
import agents.bridge.config.BridgeConfig;
import agents.bridge.config.RetryPolicy;
import agents.bridge.config.ServerConfig;
import agents.bridge.exception.ConfigException;
import agents.bridge.exception.ConnectionException;
import agents.bridge.exception.McpErrorException;
import agents.bridge.mcp.base.ToolDefinition;
import agents.bridge.mcp.base.ToolResult;
import agents.bridge.mcp.transport.RequestIdSequence;
import agents.bridge.mcp.transport.TransportFactory;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static agents.bridge.services.LogUtil.*;

/**
 * Owns the named connections to every enabled server.
 *
 * <p>Servers connect independently and concurrently, each retrying with exponential backoff.
 * Every connect attempt and every tool call outcome is recorded in the {@link HealthMonitor}.
 * Failures are recorded and then propagated to the caller; only {@link #healthCheck()} and
 * {@link #searchAcrossServers(String)} absorb them.</p>
 */
public class ConnectionManager {

    public static final String SEARCH_TOOL = "search";

    private final BridgeContext ctx;
    private final TransportFactory transportFactory;
    private final HealthMonitor health;
    private final Map<String, McpConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, RequestIdSequence> idSequences = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();

    private volatile BridgeConfig config;
    private volatile boolean initialized = false;

    public ConnectionManager(BridgeContext ctx, BridgeConfig config) {
        this(ctx, config, TransportFactory.standard(ctx), new HealthMonitor());
    }

    public ConnectionManager(BridgeContext ctx, BridgeConfig config, TransportFactory transportFactory,
                             HealthMonitor health) {
        this.ctx = ctx;
        this.config = config;
        this.transportFactory = transportFactory;
        this.health = health;
    }

    /**
     * Connect every enabled server. Completes once each server has either connected or
     * exhausted its attempts; individual failures only show up in the health records.
     */
    public Future<Void> initialize() {
        long gen = generation.get();
        List<ServerConfig> enabled = config.getEnabledServers();
        logInfo(ctx, "Initializing " + enabled.size() + " MCP servers", "ConnectionManager", "Initialize", "MCP");

        List<Future<McpConnection>> attempts = new ArrayList<>();
        for (ServerConfig server : enabled) {
            attempts.add(connectWithRetry(server, gen));
        }
        return Future.join(attempts).transform(ar -> {
            initialized = true;
            logInfo(ctx, "Connected to " + connections.size() + " of " + enabled.size() + " servers",
                "ConnectionManager", "Initialize", "MCP");
            return Future.succeededFuture();
        });
    }

    /**
     * Run the retry sequence for one server: up to {@code retryAttempts} tries, waiting
     * {@link RetryPolicy#delayAfterFailure(int)} after each failure except the last.
     */
    Future<McpConnection> connectWithRetry(ServerConfig server, long gen) {
        Promise<McpConnection> promise = Promise.promise();
        attempt(server, 1, gen, promise);
        return promise.future();
    }

    private void attempt(ServerConfig server, int attempt, long gen, Promise<McpConnection> promise) {
        if (gen != generation.get()) {
            promise.tryFail(new ConnectionException(server.getId(), "Connection attempt cancelled", null));
            return;
        }
        String serverId = server.getId();
        logDetail(ctx, "Connecting to " + serverId + " (attempt " + attempt + "/" + server.getRetryAttempts() + ")",
            "ConnectionManager", "Connect", serverId);

        McpConnection connection = new McpConnection(ctx, server, idSequence(serverId), transportFactory);
        connection.connect().onComplete(ar -> {
            if (ar.succeeded()) {
                if (gen != generation.get()) {
                    connection.disconnect();
                    promise.tryFail(new ConnectionException(serverId, "Connection attempt cancelled", null));
                    return;
                }
                health.recordConnectSuccess(serverId);
                install(connection);
                logInfo(ctx, "Connected to MCP server: " + serverId, "ConnectionManager", "Connect", serverId);
                promise.tryComplete(connection);
                return;
            }

            boolean willRetry = attempt < server.getRetryAttempts() && gen == generation.get();
            health.recordConnectFailure(serverId, ar.cause(), willRetry);
            if (!willRetry) {
                logError(ctx, "Failed to connect to MCP server " + serverId + " after " + attempt + " attempts: "
                    + ar.cause().getMessage(), "ConnectionManager", "Connect", serverId);
                promise.tryFail(ar.cause());
                return;
            }
            long delay = config.getRetryPolicy().delayAfterFailure(attempt);
            logDetail(ctx, "Attempt " + attempt + " for " + serverId + " failed (" + ar.cause().getMessage()
                + "), retrying in " + delay + "ms", "ConnectionManager", "Retry", serverId);
            ctx.getVertx().setTimer(Math.max(1, delay), t -> attempt(server, attempt + 1, gen, promise));
        });
    }

    private void install(McpConnection connection) {
        String serverId = connection.getServerId();
        McpConnection previous = connections.put(serverId, connection);
        if (previous != null && previous != connection) {
            previous.disconnect();
        }
        connection.closeHandler(err -> {
            if (!connections.remove(serverId, connection)) {
                return;
            }
            health.recordDisconnected(serverId, err.getMessage());
            if (config.isAutoReconnect() && config.getServers().containsKey(serverId)) {
                logInfo(ctx, "Reconnecting " + serverId + " after connection loss",
                    "ConnectionManager", "AutoReconnect", serverId);
                connectWithRetry(config.getServers().get(serverId), generation.get())
                    .onFailure(e -> logError(ctx, "Automatic reconnect of " + serverId + " failed: " + e.getMessage(),
                        "ConnectionManager", "AutoReconnect", serverId));
            }
        });
    }

    private RequestIdSequence idSequence(String serverId) {
        return idSequences.computeIfAbsent(serverId, id -> new RequestIdSequence());
    }

    /**
     * Close every connection and cancel retries still waiting on a timer.
     */
    public Future<Void> disconnect() {
        generation.incrementAndGet();
        List<Future<Void>> closing = new ArrayList<>();
        for (Map.Entry<String, McpConnection> entry : connections.entrySet()) {
            String serverId = entry.getKey();
            McpConnection connection = entry.getValue();
            connections.remove(serverId, connection);
            closing.add(connection.disconnect()
                .onSuccess(v -> logDetail(ctx, "Disconnected from MCP server: " + serverId,
                    "ConnectionManager", "Disconnect", serverId))
                .onFailure(err -> logError(ctx, "Error disconnecting from " + serverId + ": " + err.getMessage(),
                    "ConnectionManager", "Disconnect", serverId)));
            health.recordDisconnected(serverId, null);
        }
        initialized = false;
        return Future.join(closing).mapEmpty();
    }

    /**
     * Replace the configuration: disconnect everything, then initialize against the new server set.
     */
    public Future<Void> updateSettings(BridgeConfig newConfig) {
        return disconnect().transform(ar -> {
            this.config = newConfig;
            for (String known : health.snapshot().keySet()) {
                if (!newConfig.getServers().containsKey(known)) {
                    health.remove(known);
                }
            }
            return initialize();
        });
    }

    /**
     * Tear down the server's connection (if any) and run the retry sequence once more.
     */
    public Future<Void> reconnectServer(String serverId) {
        ServerConfig server = config.getServers().get(serverId);
        if (server == null) {
            return Future.failedFuture(new ConfigException("Unknown server: " + serverId));
        }
        McpConnection existing = connections.remove(serverId);
        Future<Void> teardown = existing == null ? Future.succeededFuture() : existing.disconnect();
        return teardown
            .transform(ar -> connectWithRetry(server, generation.get()))
            .mapEmpty();
    }

    public Future<ToolResult> callTool(String serverId, String toolName, JsonObject arguments) {
        McpConnection connection = connections.get(serverId);
        if (connection == null) {
            ConnectionException missing = new ConnectionException(serverId, "No connection to server: " + serverId, null);
            health.recordCallFailure(serverId, missing, false);
            return Future.failedFuture(missing);
        }
        logDetail(ctx, "Calling " + toolName + " on " + serverId, "ConnectionManager", "CallTool", serverId);
        return connection.callTool(toolName, arguments)
            .onSuccess(result -> health.recordCallSuccess(serverId))
            .onFailure(err -> {
                health.recordCallFailure(serverId, err, connection.isConnected());
                logDetail(ctx, "Tool " + toolName + " on " + serverId + " failed: " + err.getMessage(),
                    "ConnectionManager", "CallTool", serverId);
            });
    }

    /** Refresh and return a server's tool list. */
    public Future<List<ToolDefinition>> listTools(String serverId) {
        return withConnection(serverId).compose(McpConnection::refreshTools);
    }

    public Future<JsonArray> getResources(String serverId) {
        return withConnection(serverId).compose(McpConnection::listResources);
    }

    public Future<JsonObject> readResource(String serverId, String uri) {
        return withConnection(serverId).compose(connection -> connection.readResource(uri));
    }

    public Future<JsonObject> callMethod(String serverId, String method, JsonObject params) {
        return withConnection(serverId).compose(connection -> connection.callMethod(method, params));
    }

    private Future<McpConnection> withConnection(String serverId) {
        McpConnection connection = connections.get(serverId);
        if (connection == null) {
            return Future.failedFuture(new ConnectionException(serverId, "No connection to server: " + serverId, null));
        }
        return Future.succeededFuture(connection);
    }

    /**
     * Probe every enabled server by listing its resources. Never fails; the outcome of each
     * probe lands in the health records, and a failing probe does not disconnect.
     * A JSON-RPC error reply counts as alive.
     */
    public Future<Map<String, ConnectionHealth>> healthCheck() {
        List<Future<Void>> probes = new ArrayList<>();
        for (ServerConfig server : config.getEnabledServers()) {
            String serverId = server.getId();
            McpConnection connection = connections.get(serverId);
            if (connection == null || !connection.isConnected()) {
                if (health.get(serverId) == null || health.get(serverId).isConnected()) {
                    health.recordDisconnected(serverId, "Not connected");
                }
                continue;
            }
            probes.add(connection.listResources()
                .<Void>transform(ar -> {
                    if (ar.succeeded() || ar.cause() instanceof McpErrorException) {
                        health.recordProbeSuccess(serverId);
                    } else {
                        health.recordProbeFailure(serverId, ar.cause(), connection.isConnected());
                        logDetail(ctx, "Health probe failed for " + serverId + ": " + ar.cause().getMessage(),
                            "ConnectionManager", "HealthCheck", serverId);
                    }
                    return Future.succeededFuture();
                }));
        }
        return Future.join(probes).transform(ar -> Future.succeededFuture(health.snapshot()));
    }

    /**
     * Fan a search out to every connected server at once. A server exposing a {@code search} tool
     * is asked through it; otherwise its resources are filtered by the query text. A failing
     * server contributes nothing and does not affect the others. Each result carries a
     * {@code source} field naming its server.
     */
    public Future<JsonArray> searchAcrossServers(String query) {
        List<Future<JsonArray>> searches = new ArrayList<>();
        for (McpConnection connection : connections.values()) {
            String serverId = connection.getServerId();
            searches.add(searchServer(connection, query)
                .map(results -> tagSource(results, serverId))
                .recover(err -> {
                    logDetail(ctx, "Search failed for server " + serverId + ": " + err.getMessage(),
                        "ConnectionManager", "Search", serverId);
                    return Future.succeededFuture(new JsonArray());
                }));
        }
        return Future.join(searches).map(cf -> {
            JsonArray all = new JsonArray();
            for (Future<JsonArray> search : searches) {
                if (search.succeeded()) {
                    search.result().forEach(all::add);
                }
            }
            return all;
        });
    }

    private Future<JsonArray> searchServer(McpConnection connection, String query) {
        if (connection.hasTool(SEARCH_TOOL)) {
            return callTool(connection.getServerId(), SEARCH_TOOL, new JsonObject().put("query", query))
                .map(result -> {
                    JsonArray items = new JsonArray();
                    result.getContent().forEach(item -> items.add(item instanceof JsonObject
                        ? item
                        : new JsonObject().put("type", "text").put("text", String.valueOf(item))));
                    return items;
                });
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return connection.listResources().map(resources -> {
            JsonArray matches = new JsonArray();
            resources.forEach(resource -> {
                if (resource instanceof JsonObject && matchesResource((JsonObject) resource, needle)) {
                    matches.add(((JsonObject) resource).copy());
                }
            });
            return matches;
        });
    }

    private static boolean matchesResource(JsonObject resource, String needle) {
        for (String field : List.of("name", "uri", "description")) {
            String value = resource.getString(field);
            if (value != null && value.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static JsonArray tagSource(JsonArray results, String serverId) {
        JsonArray tagged = new JsonArray();
        results.forEach(result -> {
            JsonObject item = result instanceof JsonObject
                ? ((JsonObject) result).copy()
                : new JsonObject().put("value", result);
            tagged.add(item.put("source", serverId));
        });
        return tagged;
    }

    /** Ids of servers with a live connection. */
    public List<String> getConnectedServers() {
        return connections.values().stream()
            .filter(McpConnection::isConnected)
            .map(McpConnection::getServerId)
            .sorted()
            .toList();
    }

    public boolean isServerConnected(String serverId) {
        McpConnection connection = connections.get(serverId);
        return connection != null && connection.isConnected();
    }

    /** Cached tool list of a connected server, empty if unknown. */
    public List<ToolDefinition> getCachedTools(String serverId) {
        McpConnection connection = connections.get(serverId);
        return connection == null ? List.of() : connection.getTools();
    }

    public McpConnection getConnection(String serverId) {
        return connections.get(serverId);
    }

    public HealthMonitor getHealthMonitor() {
        return health;
    }

    public BridgeConfig getConfig() {
        return config;
    }

    public boolean isInitialized() {
        return initialized;
    }
}
