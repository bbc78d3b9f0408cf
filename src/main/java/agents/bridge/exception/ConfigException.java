package agents.bridge.exception;

/**
 * Invalid or unreadable bridge configuration.
 */
public class ConfigException extends BridgeException {

    public ConfigException(String message) {
        super(BridgeErrorCode.CONFIG_ERROR, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(BridgeErrorCode.CONFIG_ERROR, message, cause);
    }

    public ConfigException(String serverId, String message, Throwable cause) {
        super(BridgeErrorCode.CONFIG_ERROR, serverId, message, cause);
    }
}
