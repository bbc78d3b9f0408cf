package agents.bridge.mcp.transport;

import agents.bridge.BridgeContext;
import agents.bridge.config.ServerConfig;

/**
 * Creates the transport variant for a server. Chosen once per connection, never re-checked per call.
 */
@FunctionalInterface
public interface TransportFactory {

    McpTransport create(ServerConfig config, JsonRpcSession session);

    /**
     * The production mapping from transport kind to implementation.
     */
    static TransportFactory standard(BridgeContext ctx) {
        return (config, session) -> switch (config.getTransport()) {
            case PIPE -> new PipeTransport(ctx, config, session);
            case SOCKET -> new SocketTransport(ctx, config, session);
            case EVENT_STREAM -> new EventStreamTransport(ctx, config, session);
        };
    }
}
