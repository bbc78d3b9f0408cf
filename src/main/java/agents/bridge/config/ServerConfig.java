package agents.bridge.config;

import agents.bridge.exception.ConfigException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one tool server. Replacing it means recreating the connection.
 */
public class ServerConfig {

    public static final int DEFAULT_RETRY_ATTEMPTS = 3;

    private final String id;
    private final String name;
    private final TransportKind transport;
    private final String command;
    private final List<String> args;
    private final Map<String, String> env;
    private final String workingDirectory;
    private final String url;
    private final boolean enabled;
    private final long timeout;
    private final int retryAttempts;

    private ServerConfig(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.name = builder.name == null ? builder.id : builder.name;
        this.transport = builder.transport;
        this.command = builder.command;
        this.args = List.copyOf(builder.args);
        this.env = Map.copyOf(builder.env);
        this.workingDirectory = builder.workingDirectory;
        this.url = builder.url;
        this.enabled = builder.enabled;
        this.timeout = builder.timeout;
        this.retryAttempts = Math.max(1, builder.retryAttempts);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TransportKind getTransport() {
        return transport;
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArgs() {
        return args;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public String getUrl() {
        return url;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long getTimeout() {
        return timeout;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    /**
     * Check that the fields the selected transport needs are present.
     * Disabled servers are never validated.
     */
    public void validate() {
        if (!enabled) {
            return;
        }
        if (transport == TransportKind.PIPE && (command == null || command.isBlank())) {
            throw new ConfigException("Server " + id + " uses stdio but has no command");
        }
        if (transport != TransportKind.PIPE && (url == null || url.isBlank())) {
            throw new ConfigException("Server " + id + " uses " + transport.getConfigName() + " but has no url");
        }
        if (timeout <= 0) {
            throw new ConfigException("Server " + id + " has a non-positive timeout");
        }
    }

    /**
     * Parse one entry of the {@code servers} object.
     * Accepts {@code transport} as an alias of {@code type}.
     */
    public static ServerConfig fromJson(String id, JsonObject json, long defaultTimeout) {
        Builder builder = builder(id)
            .name(json.getString("name", id))
            .transport(TransportKind.fromConfig(json.getString("type", json.getString("transport"))))
            .command(json.getString("command"))
            .workingDirectory(json.getString("workingDirectory"))
            .url(json.getString("url"))
            .enabled(json.getBoolean("enabled", false))
            .timeout(json.getLong("timeout", defaultTimeout))
            .retryAttempts(json.getInteger("retryAttempts", DEFAULT_RETRY_ATTEMPTS));

        JsonArray args = json.getJsonArray("args");
        if (args != null) {
            List<String> argList = new ArrayList<>();
            args.forEach(a -> argList.add(String.valueOf(a)));
            builder.args(argList);
        }
        JsonObject env = json.getJsonObject("env");
        if (env != null) {
            Map<String, String> envMap = new LinkedHashMap<>();
            env.forEach(e -> envMap.put(e.getKey(), String.valueOf(e.getValue())));
            builder.env(envMap);
        }
        return builder.build();
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("name", name)
            .put("type", transport.getConfigName())
            .put("enabled", enabled)
            .put("timeout", timeout)
            .put("retryAttempts", retryAttempts);
        if (command != null) {
            json.put("command", command).put("args", new JsonArray(args));
        }
        if (!env.isEmpty()) {
            JsonObject envJson = new JsonObject();
            env.forEach(envJson::put);
            json.put("env", envJson);
        }
        if (workingDirectory != null) {
            json.put("workingDirectory", workingDirectory);
        }
        if (url != null) {
            json.put("url", url);
        }
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServerConfig)) {
            return false;
        }
        ServerConfig that = (ServerConfig) o;
        return enabled == that.enabled
            && timeout == that.timeout
            && retryAttempts == that.retryAttempts
            && id.equals(that.id)
            && name.equals(that.name)
            && transport == that.transport
            && Objects.equals(command, that.command)
            && args.equals(that.args)
            && env.equals(that.env)
            && Objects.equals(workingDirectory, that.workingDirectory)
            && Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, transport, command, args, env, workingDirectory, url, enabled, timeout, retryAttempts);
    }

    @Override
    public String toString() {
        return "ServerConfig{id='" + id + "', transport=" + transport + ", enabled=" + enabled + "}";
    }

    public static class Builder {
        private final String id;
        private String name;
        private TransportKind transport = TransportKind.PIPE;
        private String command;
        private List<String> args = List.of();
        private Map<String, String> env = Map.of();
        private String workingDirectory;
        private String url;
        private boolean enabled;
        private long timeout = BridgeConfig.DEFAULT_SERVER_TIMEOUT;
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder transport(TransportKind transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder args(List<String> args) {
            this.args = args == null ? List.of() : args;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env == null ? Map.of() : env;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder timeout(long timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
