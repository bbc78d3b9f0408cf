package agents.bridge.services;

import agents.bridge.BridgeContext;
import agents.bridge.config.BridgeConfig;
import agents.bridge.config.ConfigLoader;
import agents.bridge.exception.BridgeException;
import agents.bridge.mcp.client.ConnectionHealth;
import agents.bridge.mcp.client.ConnectionManager;
import agents.bridge.mcp.client.HealthMonitor;
import agents.bridge.mcp.discovery.ServerDiscovery;
import agents.bridge.mcp.transport.TransportFactory;
import agents.bridge.routing.QueryRouter;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.function.Function;

import static agents.bridge.services.LogUtil.*;

/**
 * Hosts the connection and routing engine and exposes it on the event bus.
 *
 * <p>All requests and replies are {@link JsonObject}s. A failed operation is answered with
 * {@code message.fail(code, text)} where the code follows HTTP conventions
 * (see {@link #failureCode(Throwable)}).</p>
 */
public class BridgeVerticle extends AbstractVerticle {

    public static final String QUERY_ADDRESS = "mcp.bridge.query";
    public static final String CALL_TOOL_ADDRESS = "mcp.bridge.callTool";
    public static final String CATALOG_ADDRESS = "mcp.bridge.catalog";
    public static final String HEALTH_ADDRESS = "mcp.bridge.health";
    public static final String SEARCH_ADDRESS = "mcp.bridge.search";
    public static final String RECONNECT_ADDRESS = "mcp.bridge.reconnect";
    public static final String SETTINGS_ADDRESS = "mcp.bridge.settings.update";
    public static final String READY_ADDRESS = "mcp.bridge.ready";

    private final BridgeContext ctx;
    private final BridgeConfig initialConfig;
    private final TransportFactory transportFactory;

    private ConnectionManager connectionManager;
    private ServerDiscovery discovery;
    private LlmAPIService llm;
    private QueryRouter router;
    private BridgeService bridgeService;
    private long healthTimerId = -1;

    public BridgeVerticle(BridgeContext ctx, BridgeConfig config) {
        this(ctx, config, null);
    }

    /**
     * @param transportFactory transport source for every connection, {@code null} for the standard one
     */
    public BridgeVerticle(BridgeContext ctx, BridgeConfig config, TransportFactory transportFactory) {
        this.ctx = ctx;
        this.initialConfig = config;
        this.transportFactory = transportFactory;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        ctx.setLogLevel(initialConfig.getLogLevel());
        connectionManager = new ConnectionManager(ctx, initialConfig,
            transportFactory == null ? TransportFactory.standard(ctx) : transportFactory, new HealthMonitor());
        wireRouting(initialConfig);
        registerConsumers();

        connectionManager.initialize()
            .compose(v -> discovery.start())
            .onComplete(ar -> {
                if (ar.failed()) {
                    logError(ctx, "Initial discovery failed: " + ar.cause().getMessage(),
                        "BridgeVerticle", "Start", "System");
                }
                scheduleHealthChecks(initialConfig.getHealthCheckInterval());
                logInfo(ctx, "MCP bridge ready with " + connectionManager.getConnectedServers().size()
                    + " connected servers", "BridgeVerticle", "Start", "System");
                vertx.eventBus().publish(READY_ADDRESS, new JsonObject()
                    .put("connectedServers", new JsonArray(connectionManager.getConnectedServers()))
                    .put("timestamp", System.currentTimeMillis()));
                startPromise.complete();
            });
    }

    private void wireRouting(BridgeConfig config) {
        if (discovery != null) {
            discovery.stop();
        }
        if (llm != null) {
            llm.close();
        }
        discovery = new ServerDiscovery(ctx, connectionManager, config.getDiscoveryInterval());
        llm = config.getLlm().isConfigured() ? new LlmAPIService(ctx, config.getLlm()) : null;
        router = new QueryRouter(ctx, discovery, llm);
        bridgeService = new BridgeService(ctx, connectionManager, discovery, router);
        if (llm == null) {
            logInfo(ctx, "No LLM provider configured, routing with keyword rules only",
                "BridgeVerticle", "Setup", "Routing");
        }
    }

    private void scheduleHealthChecks(long interval) {
        if (healthTimerId >= 0) {
            vertx.cancelTimer(healthTimerId);
        }
        healthTimerId = vertx.setPeriodic(Math.max(1, interval), id -> connectionManager.healthCheck()
            .onSuccess(snapshot -> logDebug(ctx, "Health check: " + summarize(snapshot),
                "BridgeVerticle", "HealthCheck", "Health")));
    }

    private void registerConsumers() {
        consume(QUERY_ADDRESS, body -> {
            String query = body.getString("query");
            if (query == null) {
                return Future.failedFuture(new IllegalArgumentException("Missing query"));
            }
            return bridgeService.processQuery(query);
        });

        consume(CALL_TOOL_ADDRESS, body -> {
            String server = body.getString("server");
            String tool = body.getString("tool");
            if (server == null || tool == null) {
                return Future.failedFuture(new IllegalArgumentException("Missing server or tool"));
            }
            return connectionManager.callTool(server, tool, body.getJsonObject("arguments", new JsonObject()))
                .map(result -> result.toJson().put("server", server).put("tool", tool));
        });

        consume(CATALOG_ADDRESS, body -> (body.getBoolean("refresh", false)
            ? discovery.discoverAllServers()
            : discovery.ensureFresh()).map(catalog -> catalog.toJson()));

        consume(HEALTH_ADDRESS, body -> connectionManager.healthCheck().map(snapshot -> {
            JsonObject servers = new JsonObject();
            snapshot.forEach((id, h) -> servers.put(id, h.toJson()));
            return new JsonObject()
                .put("initialized", connectionManager.isInitialized())
                .put("connectedServers", new JsonArray(connectionManager.getConnectedServers()))
                .put("servers", servers)
                .put("timestamp", System.currentTimeMillis());
        }));

        consume(SEARCH_ADDRESS, body -> {
            String query = body.getString("query");
            if (query == null) {
                return Future.failedFuture(new IllegalArgumentException("Missing query"));
            }
            return connectionManager.searchAcrossServers(query)
                .map(results -> new JsonObject().put("query", query).put("results", results));
        });

        consume(RECONNECT_ADDRESS, body -> {
            String server = body.getString("server");
            if (server == null) {
                return Future.failedFuture(new IllegalArgumentException("Missing server"));
            }
            return connectionManager.reconnectServer(server)
                .compose(v -> discovery.discoverAllServers())
                .map(catalog -> new JsonObject()
                    .put("server", server)
                    .put("connected", connectionManager.isServerConnected(server)));
        });

        consume(SETTINGS_ADDRESS, body -> {
            BridgeConfig next;
            try {
                next = new ConfigLoader(ctx).fromDocument(body);
            } catch (BridgeException e) {
                return Future.failedFuture(e);
            }
            return updateSettings(next);
        });
    }

    private Future<JsonObject> updateSettings(BridgeConfig next) {
        logInfo(ctx, "Applying new settings with " + next.getEnabledServers().size() + " enabled servers",
            "BridgeVerticle", "UpdateSettings", "Config");
        ctx.setLogLevel(next.getLogLevel());
        discovery.stop();
        return connectionManager.updateSettings(next)
            .compose(v -> {
                wireRouting(next);
                scheduleHealthChecks(next.getHealthCheckInterval());
                return discovery.start();
            })
            .map(catalog -> new JsonObject()
                .put("connectedServers", new JsonArray(connectionManager.getConnectedServers()))
                .put("settings", next.toSafeJson()));
    }

    private void consume(String address, Function<JsonObject, Future<JsonObject>> operation) {
        Handler<Message<JsonObject>> handler = msg -> {
            JsonObject body = msg.body() == null ? new JsonObject() : msg.body();
            Future<JsonObject> result;
            try {
                result = operation.apply(body);
            } catch (RuntimeException e) {
                result = Future.failedFuture(e);
            }
            result.onComplete(ar -> {
                if (ar.succeeded()) {
                    msg.reply(ar.result());
                } else {
                    logDetail(ctx, address + " failed: " + ar.cause().getMessage(),
                        "BridgeVerticle", "EventBus", "Bridge");
                    msg.fail(failureCode(ar.cause()), String.valueOf(ar.cause().getMessage()));
                }
            });
        };
        vertx.eventBus().consumer(address, handler);
    }

    /**
     * Map a failure onto an HTTP-style status code for event bus and HTTP callers.
     */
    public static int failureCode(Throwable err) {
        if (err instanceof IllegalArgumentException) {
            return 400;
        }
        if (!(err instanceof BridgeException)) {
            return 500;
        }
        switch (((BridgeException) err).getCode()) {
            case TOOL_NOT_FOUND:
                return 404;
            case ROUTING_VALIDATION_ERROR:
            case CONFIG_ERROR:
                return 400;
            case REQUEST_TIMEOUT:
                return 504;
            case CONNECTION_ERROR:
                return 503;
            case REMOTE_ERROR:
            case PROTOCOL_ERROR:
            case LLM_PROVIDER_ERROR:
                return 502;
            default:
                return 500;
        }
    }

    private static String summarize(Map<String, ConnectionHealth> snapshot) {
        StringBuilder sb = new StringBuilder();
        snapshot.forEach((id, h) -> sb.append(id).append('=').append(h.isHealthy() ? "healthy" : "unhealthy").append(' '));
        return sb.toString().trim();
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public ServerDiscovery getDiscovery() {
        return discovery;
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (healthTimerId >= 0) {
            vertx.cancelTimer(healthTimerId);
        }
        discovery.stop();
        if (llm != null) {
            llm.close();
        }
        connectionManager.disconnect().onComplete(ar -> {
            logInfo(ctx, "MCP bridge stopped", "BridgeVerticle", "Stop", "System");
            stopPromise.complete();
        });
    }
}
