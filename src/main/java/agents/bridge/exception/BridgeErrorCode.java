package agents.bridge.exception;

/**
 * Stable error codes for everything the engine reports to its callers.
 */
public enum BridgeErrorCode {
    CONNECTION_ERROR,
    PROTOCOL_ERROR,
    REMOTE_ERROR,
    TOOL_NOT_FOUND,
    REQUEST_TIMEOUT,
    ROUTING_VALIDATION_ERROR,
    LLM_PROVIDER_ERROR,
    CONFIG_ERROR
}
