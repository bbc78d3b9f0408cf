package agents.bridge.mcp.client;

import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Per-server health records. Each entry is replaced atomically, and only the owning server's
 * connect, call and probe paths write it.
 */
public class HealthMonitor {

    private final Map<String, ConnectionHealth> records = new ConcurrentHashMap<>();

    public ConnectionHealth recordConnectSuccess(String serverId) {
        return update(serverId, h -> h.connectSucceeded(now()));
    }

    /**
     * @param willRetry true if another attempt is scheduled after this failure
     */
    public ConnectionHealth recordConnectFailure(String serverId, Throwable error, boolean willRetry) {
        return update(serverId, h -> h.connectFailed(describe(error), willRetry, now()));
    }

    public ConnectionHealth recordCallSuccess(String serverId) {
        return update(serverId, h -> h.operationSucceeded(true, now()));
    }

    public ConnectionHealth recordCallFailure(String serverId, Throwable error, boolean stillConnected) {
        return update(serverId, h -> h.operationFailed(describe(error), stillConnected, true, now()));
    }

    public ConnectionHealth recordProbeSuccess(String serverId) {
        return update(serverId, h -> h.operationSucceeded(false, now()));
    }

    /** A failed probe degrades health but leaves the connected flag alone. */
    public ConnectionHealth recordProbeFailure(String serverId, Throwable error, boolean stillConnected) {
        return update(serverId, h -> h.operationFailed(describe(error), stillConnected, false, now()));
    }

    public ConnectionHealth recordDisconnected(String serverId, String reason) {
        return update(serverId, h -> h.disconnected(reason, now()));
    }

    public ConnectionHealth get(String serverId) {
        return records.get(serverId);
    }

    public void remove(String serverId) {
        records.remove(serverId);
    }

    /**
     * Point-in-time copy ordered by server id.
     */
    public Map<String, ConnectionHealth> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(new TreeMap<>(records)));
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        snapshot().forEach((id, health) -> json.put(id, health.toJson()));
        return json;
    }

    private ConnectionHealth update(String serverId, UnaryOperator<ConnectionHealth> change) {
        return records.compute(serverId, (id, current) ->
            change.apply(current == null ? ConnectionHealth.initial(id) : current));
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
