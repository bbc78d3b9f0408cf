package agents.bridge.exception;

/**
 * A JSON-RPC error reply from a tool server.
 */
public class McpErrorException extends BridgeException {

    private final int errorCode;

    public McpErrorException(String serverId, int errorCode, String message) {
        super(BridgeErrorCode.REMOTE_ERROR, serverId, "MCP Error: " + message, null);
        this.errorCode = errorCode;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
