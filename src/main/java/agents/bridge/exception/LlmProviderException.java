package agents.bridge.exception;

/**
 * Transport, authentication or parse failure while talking to the LLM provider.
 */
public class LlmProviderException extends BridgeException {

    public LlmProviderException(String message) {
        super(BridgeErrorCode.LLM_PROVIDER_ERROR, message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(BridgeErrorCode.LLM_PROVIDER_ERROR, message, cause);
    }

    public LlmProviderException(String serverId, String message, Throwable cause) {
        super(BridgeErrorCode.LLM_PROVIDER_ERROR, serverId, message, cause);
    }
}
