package agents.bridge.config;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The full bridge configuration: server set, retry policy, discovery and routing settings.
 */
public class BridgeConfig {

    public static final long DEFAULT_SERVER_TIMEOUT = 30000;
    public static final long DEFAULT_DISCOVERY_INTERVAL = 5 * 60 * 1000;
    public static final long DEFAULT_HEALTH_CHECK_INTERVAL = 30000;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.3;
    public static final int DEFAULT_LOG_LEVEL = 2;
    public static final int DEFAULT_HTTP_PORT = 8090;

    private final Map<String, ServerConfig> servers;
    private final long defaultTimeout;
    private final RetryPolicy retryPolicy;
    private final long discoveryInterval;
    private final long healthCheckInterval;
    private final double confidenceThreshold;
    private final int logLevel;
    private final boolean httpEnabled;
    private final int httpPort;
    private final LlmProviderConfig llm;
    private final boolean autoReconnect;

    public BridgeConfig(Map<String, ServerConfig> servers, long defaultTimeout, RetryPolicy retryPolicy,
                        long discoveryInterval, long healthCheckInterval, double confidenceThreshold,
                        int logLevel, boolean httpEnabled, int httpPort, LlmProviderConfig llm) {
        this(servers, defaultTimeout, retryPolicy, discoveryInterval, healthCheckInterval, confidenceThreshold,
            logLevel, httpEnabled, httpPort, llm, true);
    }

    public BridgeConfig(Map<String, ServerConfig> servers, long defaultTimeout, RetryPolicy retryPolicy,
                        long discoveryInterval, long healthCheckInterval, double confidenceThreshold,
                        int logLevel, boolean httpEnabled, int httpPort, LlmProviderConfig llm,
                        boolean autoReconnect) {
        this.servers = Collections.unmodifiableMap(new LinkedHashMap<>(servers));
        this.defaultTimeout = defaultTimeout;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        this.discoveryInterval = discoveryInterval;
        this.healthCheckInterval = healthCheckInterval;
        this.confidenceThreshold = confidenceThreshold;
        this.logLevel = logLevel;
        this.httpEnabled = httpEnabled;
        this.httpPort = httpPort;
        this.llm = llm == null ? LlmProviderConfig.none() : llm;
        this.autoReconnect = autoReconnect;
    }

    /**
     * Built-in configuration: the three well-known npx servers, all disabled.
     */
    public static BridgeConfig defaults() {
        return fromJson(defaultJson());
    }

    public static JsonObject defaultJson() {
        return new JsonObject()
            .put("servers", new JsonObject()
                .put("filesystem", new JsonObject()
                    .put("name", "File System")
                    .put("type", "stdio")
                    .put("command", "npx")
                    .put("args", new JsonArray().add("-y").add("@modelcontextprotocol/server-filesystem").add("."))
                    .put("enabled", false)
                    .put("timeout", DEFAULT_SERVER_TIMEOUT)
                    .put("retryAttempts", 3))
                .put("git", new JsonObject()
                    .put("name", "Git Repository")
                    .put("type", "stdio")
                    .put("command", "npx")
                    .put("args", new JsonArray().add("-y").add("@modelcontextprotocol/server-git").add("--repository").add("."))
                    .put("enabled", false)
                    .put("timeout", DEFAULT_SERVER_TIMEOUT)
                    .put("retryAttempts", 3))
                .put("web-search", new JsonObject()
                    .put("name", "Web Search")
                    .put("type", "stdio")
                    .put("command", "npx")
                    .put("args", new JsonArray().add("-y").add("@modelcontextprotocol/server-brave-search"))
                    .put("env", new JsonObject().put("BRAVE_API_KEY", "${BRAVE_API_KEY}"))
                    .put("enabled", false)
                    .put("timeout", DEFAULT_SERVER_TIMEOUT)
                    .put("retryAttempts", 3)))
            .put("defaultTimeout", DEFAULT_SERVER_TIMEOUT)
            .put("retry", RetryPolicy.defaults().toJson())
            .put("discoveryInterval", DEFAULT_DISCOVERY_INTERVAL)
            .put("healthCheckInterval", DEFAULT_HEALTH_CHECK_INTERVAL)
            .put("confidenceThreshold", DEFAULT_CONFIDENCE_THRESHOLD)
            .put("logLevel", DEFAULT_LOG_LEVEL)
            .put("http", new JsonObject().put("enabled", false).put("port", DEFAULT_HTTP_PORT));
    }

    /**
     * Build from an already substituted configuration document.
     * Server entries are parsed but not validated here.
     */
    public static BridgeConfig fromJson(JsonObject json) {
        long defaultTimeout = json.getLong("defaultTimeout", DEFAULT_SERVER_TIMEOUT);

        Map<String, ServerConfig> servers = new LinkedHashMap<>();
        JsonObject serversJson = json.getJsonObject("servers", new JsonObject());
        for (String id : serversJson.fieldNames()) {
            servers.put(id, ServerConfig.fromJson(id, serversJson.getJsonObject(id, new JsonObject()), defaultTimeout));
        }

        JsonObject http = json.getJsonObject("http", new JsonObject());
        return new BridgeConfig(
            servers,
            defaultTimeout,
            RetryPolicy.fromJson(json.getJsonObject("retry")),
            json.getLong("discoveryInterval", DEFAULT_DISCOVERY_INTERVAL),
            json.getLong("healthCheckInterval", DEFAULT_HEALTH_CHECK_INTERVAL),
            json.getDouble("confidenceThreshold", DEFAULT_CONFIDENCE_THRESHOLD),
            json.getInteger("logLevel", DEFAULT_LOG_LEVEL),
            http.getBoolean("enabled", false),
            http.getInteger("port", DEFAULT_HTTP_PORT),
            LlmProviderConfig.fromJson(json.getJsonObject("llm")),
            json.getBoolean("autoReconnect", true));
    }

    /** Validate every server entry. */
    public BridgeConfig validate() {
        servers.values().forEach(ServerConfig::validate);
        return this;
    }

    public Map<String, ServerConfig> getServers() {
        return servers;
    }

    public List<ServerConfig> getEnabledServers() {
        return servers.values().stream()
            .filter(ServerConfig::isEnabled)
            .toList();
    }

    public long getDefaultTimeout() {
        return defaultTimeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public long getDiscoveryInterval() {
        return discoveryInterval;
    }

    public long getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public int getLogLevel() {
        return logLevel;
    }

    public boolean isHttpEnabled() {
        return httpEnabled;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public LlmProviderConfig getLlm() {
        return llm;
    }

    /** Whether a connection that drops on its own is re-established automatically. */
    public boolean isAutoReconnect() {
        return autoReconnect;
    }

    /** Summary without secrets. */
    public JsonObject toSafeJson() {
        JsonObject serversJson = new JsonObject();
        servers.forEach((id, server) -> {
            JsonObject entry = server.toJson();
            entry.remove("env");
            serversJson.put(id, entry);
        });
        return new JsonObject()
            .put("servers", serversJson)
            .put("defaultTimeout", defaultTimeout)
            .put("retry", retryPolicy.toJson())
            .put("discoveryInterval", discoveryInterval)
            .put("healthCheckInterval", healthCheckInterval)
            .put("confidenceThreshold", confidenceThreshold)
            .put("logLevel", logLevel)
            .put("autoReconnect", autoReconnect)
            .put("http", new JsonObject().put("enabled", httpEnabled).put("port", httpPort))
            .put("llm", llm.toSafeJson());
    }
}
