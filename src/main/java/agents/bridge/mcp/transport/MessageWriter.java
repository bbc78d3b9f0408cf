package agents.bridge.mcp.transport;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Writes one outbound JSON-RPC message to the underlying channel.
 */
@FunctionalInterface
public interface MessageWriter {

    Future<Void> write(JsonObject message);
}
