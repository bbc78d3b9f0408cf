package agents.bridge.config;

import agents.bridge.exception.ConfigException;

/**
 * The closed set of transport variants a server can be reached through.
 */
public enum TransportKind {
    PIPE("stdio"),
    SOCKET("websocket"),
    EVENT_STREAM("sse");

    private final String configName;

    TransportKind(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Parse the {@code type} field of a server entry. Null means the default pipe transport.
     */
    public static TransportKind fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return PIPE;
        }
        return switch (value.trim().toLowerCase()) {
            case "stdio", "pipe" -> PIPE;
            case "websocket", "socket", "ws" -> SOCKET;
            case "sse", "event-stream" -> EVENT_STREAM;
            default -> throw new ConfigException("Unknown transport type: " + value);
        };
    }
}
