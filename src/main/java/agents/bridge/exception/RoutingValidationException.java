package agents.bridge.exception;

/**
 * A routing plan references a server or tool missing from the catalog snapshot.
 */
public class RoutingValidationException extends BridgeException {

    public RoutingValidationException(String message) {
        super(BridgeErrorCode.ROUTING_VALIDATION_ERROR, message);
    }

    public RoutingValidationException(String message, Throwable cause) {
        super(BridgeErrorCode.ROUTING_VALIDATION_ERROR, message, cause);
    }

    public RoutingValidationException(String serverId, String message, Throwable cause) {
        super(BridgeErrorCode.ROUTING_VALIDATION_ERROR, serverId, message, cause);
    }
}
