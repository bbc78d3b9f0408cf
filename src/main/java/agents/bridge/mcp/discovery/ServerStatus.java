package agents.bridge.mcp.discovery;

public enum ServerStatus {
    CONNECTED,
    DISCONNECTED,
    ERROR;

    public String jsonValue() {
        return name().toLowerCase();
    }
}
