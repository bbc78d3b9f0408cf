package agents.bridge.exception;

/**
 * Raised locally, before anything is sent, when a tool is not exposed by the target server.
 */
public class ToolNotFoundException extends BridgeException {

    private final String toolName;

    public ToolNotFoundException(String serverId, String toolName) {
        super(BridgeErrorCode.TOOL_NOT_FOUND, serverId,
            "Tool " + toolName + " not found on server " + serverId, null);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
