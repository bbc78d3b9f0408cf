package agents.bridge.exception;

/**
 * No correlated reply arrived before the request deadline.
 */
public class RequestTimeoutException extends BridgeException {

    public RequestTimeoutException(String message) {
        super(BridgeErrorCode.REQUEST_TIMEOUT, message);
    }

    public RequestTimeoutException(String message, Throwable cause) {
        super(BridgeErrorCode.REQUEST_TIMEOUT, message, cause);
    }

    public RequestTimeoutException(String serverId, String message, Throwable cause) {
        super(BridgeErrorCode.REQUEST_TIMEOUT, serverId, message, cause);
    }
}
