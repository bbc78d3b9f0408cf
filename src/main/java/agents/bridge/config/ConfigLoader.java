package agents.bridge.config;

import agents.bridge.BridgeContext;
import agents.bridge.exception.ConfigException;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static agents.bridge.services.LogUtil.*;

/**
 * Loads the bridge configuration from a JSON file.
 *
 * <p>The path comes from the {@code MCP_BRIDGE_CONFIG} system property or environment variable,
 * falling back to {@code mcp-bridge.json}. A missing or unparseable file yields the built-in
 * defaults. {@code ${NAME}} placeholders in string values are resolved from system properties
 * first, then the OS environment.</p>
 */
public class ConfigLoader {

    public static final String DEFAULT_CONFIG_PATH = "mcp-bridge.json";
    public static final String CONFIG_ENV_VAR = "MCP_BRIDGE_CONFIG";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_.\\-]+)}");

    private final BridgeContext ctx;
    private final Function<String, String> lookup;

    public ConfigLoader(BridgeContext ctx) {
        this(ctx, ConfigLoader::lookupProperty);
    }

    public ConfigLoader(BridgeContext ctx, Function<String, String> lookup) {
        this.ctx = ctx;
        this.lookup = lookup;
    }

    /**
     * Load from the configured path
     */
    public Future<BridgeConfig> load() {
        String configPath = lookup.apply(CONFIG_ENV_VAR);
        if (configPath == null || configPath.isBlank()) {
            configPath = DEFAULT_CONFIG_PATH;
        }
        return load(configPath);
    }

    public Future<BridgeConfig> load(String configPath) {
        return ctx.getVertx().fileSystem().exists(configPath)
            .compose(exists -> {
                if (!exists) {
                    logInfo(ctx, "Config file not found, using defaults: " + configPath,
                        "ConfigLoader", "Load", "Config");
                    return Future.succeededFuture(BridgeConfig.defaultJson());
                }
                return ctx.getVertx().fileSystem().readFile(configPath)
                    .map(buffer -> parseOrDefault(buffer, configPath))
                    .recover(err -> {
                        logError(ctx, "Failed to read config " + configPath + ": " + err.getMessage(),
                            "ConfigLoader", "Load", "Config");
                        return Future.succeededFuture(BridgeConfig.defaultJson());
                    });
            })
            .compose(json -> {
                try {
                    BridgeConfig config = fromDocument(json);
                    logInfo(ctx, "Loaded configuration with " + config.getServers().size() + " servers ("
                        + config.getEnabledServers().size() + " enabled)", "ConfigLoader", "Load", "Config");
                    return Future.succeededFuture(config);
                } catch (ConfigException e) {
                    logError(ctx, "Invalid configuration: " + e.getMessage(), "ConfigLoader", "Validate", "Config");
                    return Future.failedFuture(e);
                }
            });
    }

    /**
     * Substitute placeholders, parse and validate an in-memory document.
     */
    public BridgeConfig fromDocument(JsonObject json) {
        return BridgeConfig.fromJson(substitute(json)).validate();
    }

    private JsonObject parseOrDefault(Buffer buffer, String configPath) {
        try {
            return new JsonObject(buffer);
        } catch (DecodeException e) {
            logError(ctx, "Failed to parse config " + configPath + ", using defaults: " + e.getMessage(),
                "ConfigLoader", "Parse", "Config");
            return BridgeConfig.defaultJson();
        }
    }

    /**
     * Return a copy of the document with every {@code ${NAME}} placeholder resolved.
     * Unresolved names become empty strings.
     */
    public JsonObject substitute(JsonObject json) {
        JsonObject out = new JsonObject();
        json.forEach(entry -> out.put(entry.getKey(), substituteValue(entry.getValue())));
        return out;
    }

    private JsonArray substitute(JsonArray array) {
        JsonArray out = new JsonArray();
        array.forEach(value -> out.add(substituteValue(value)));
        return out;
    }

    private Object substituteValue(Object value) {
        if (value instanceof JsonObject) {
            return substitute((JsonObject) value);
        }
        if (value instanceof JsonArray) {
            return substitute((JsonArray) value);
        }
        if (value instanceof String) {
            return substituteString((String) value);
        }
        return value;
    }

    String substituteString(String value) {
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String resolved = lookup.apply(name);
            if (resolved == null) {
                logInfo(ctx, "Unresolved config placeholder " + name + " replaced with empty string",
                    "ConfigLoader", "Substitute", "Config");
                resolved = "";
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * System properties first (populated from .env.local), then the process environment.
     */
    public static String lookupProperty(String name) {
        String value = System.getProperty(name);
        if (value == null || value.isEmpty()) {
            value = System.getenv(name);
        }
        return value;
    }
}
