package agents.bridge.exception;

/**
 * Malformed frame or request id collision on a JSON-RPC session.
 */
public class ProtocolException extends BridgeException {

    public ProtocolException(String message) {
        super(BridgeErrorCode.PROTOCOL_ERROR, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(BridgeErrorCode.PROTOCOL_ERROR, message, cause);
    }

    public ProtocolException(String serverId, String message, Throwable cause) {
        super(BridgeErrorCode.PROTOCOL_ERROR, serverId, message, cause);
    }
}
