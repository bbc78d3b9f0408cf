package agents.bridge.exception;

import java.util.Objects;

/**
 * Base runtime exception for the bridge with a stable {@link BridgeErrorCode}.
 * Subclasses narrow the code; the server id is attached when the failure belongs to one server.
 */
public class BridgeException extends RuntimeException {

    private final BridgeErrorCode code;
    private final String serverId;

    public BridgeException(BridgeErrorCode code, String message) {
        this(code, null, message, null);
    }

    public BridgeException(BridgeErrorCode code, String message, Throwable cause) {
        this(code, null, message, cause);
    }

    public BridgeException(BridgeErrorCode code, String serverId, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.serverId = serverId;
    }

    public BridgeErrorCode getCode() {
        return code;
    }

    /** Server the failure belongs to, or null when it is not server specific. */
    public String getServerId() {
        return serverId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
            + "{code=" + code
            + (serverId == null ? "" : ", serverId=" + serverId)
            + ", message=" + getMessage()
            + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
            + '}';
    }
}
