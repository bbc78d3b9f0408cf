package agents.bridge.exception;

/**
 * Spawn, socket, handshake or connection-loss failure.
 */
public class ConnectionException extends BridgeException {

    public ConnectionException(String message) {
        super(BridgeErrorCode.CONNECTION_ERROR, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(BridgeErrorCode.CONNECTION_ERROR, message, cause);
    }

    public ConnectionException(String serverId, String message, Throwable cause) {
        super(BridgeErrorCode.CONNECTION_ERROR, serverId, message, cause);
    }
}
