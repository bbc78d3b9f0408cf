package agents.bridge.mcp.client;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health snapshot for one server. History (retry count, call counters) accumulates
 * across reconnects even though the connection object itself is replaced.
 */
public class ConnectionHealth {

    private final String serverId;
    private final boolean connected;
    private final String lastError;
    private final int retryCount;
    private final long lastRetryTimestamp;
    private final int consecutiveFailures;
    private final long successfulCalls;
    private final long failedCalls;
    private final long lastUpdated;

    public ConnectionHealth(String serverId, boolean connected, String lastError, int retryCount,
                            long lastRetryTimestamp, int consecutiveFailures, long successfulCalls,
                            long failedCalls, long lastUpdated) {
        this.serverId = serverId;
        this.connected = connected;
        this.lastError = lastError;
        this.retryCount = retryCount;
        this.lastRetryTimestamp = lastRetryTimestamp;
        this.consecutiveFailures = consecutiveFailures;
        this.successfulCalls = successfulCalls;
        this.failedCalls = failedCalls;
        this.lastUpdated = lastUpdated;
    }

    public static ConnectionHealth initial(String serverId) {
        return new ConnectionHealth(serverId, false, null, 0, 0, 0, 0, 0, System.currentTimeMillis());
    }

    public String getServerId() {
        return serverId;
    }

    public boolean isConnected() {
        return connected;
    }

    public String getLastError() {
        return lastError;
    }

    /** Failed connection attempts since this record was created. */
    public int getRetryCount() {
        return retryCount;
    }

    /** Epoch millis of the last failed attempt that was retried, 0 if none. */
    public long getLastRetryTimestamp() {
        return lastRetryTimestamp;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public long getSuccessfulCalls() {
        return successfulCalls;
    }

    public long getFailedCalls() {
        return failedCalls;
    }

    public long getLastUpdated() {
        return lastUpdated;
    }

    /** Connected and the latest operation succeeded. */
    public boolean isHealthy() {
        return connected && consecutiveFailures == 0;
    }

    ConnectionHealth connectSucceeded(long now) {
        return new ConnectionHealth(serverId, true, null, retryCount, lastRetryTimestamp,
            0, successfulCalls, failedCalls, now);
    }

    ConnectionHealth connectFailed(String error, boolean willRetry, long now) {
        return new ConnectionHealth(serverId, false, error, retryCount + 1,
            willRetry ? now : lastRetryTimestamp, consecutiveFailures + 1, successfulCalls, failedCalls, now);
    }

    ConnectionHealth operationSucceeded(boolean countAsCall, long now) {
        return new ConnectionHealth(serverId, connected, lastError, retryCount, lastRetryTimestamp,
            0, countAsCall ? successfulCalls + 1 : successfulCalls, failedCalls, now);
    }

    ConnectionHealth operationFailed(String error, boolean stillConnected, boolean countAsCall, long now) {
        return new ConnectionHealth(serverId, stillConnected, error, retryCount, lastRetryTimestamp,
            consecutiveFailures + 1, successfulCalls, countAsCall ? failedCalls + 1 : failedCalls, now);
    }

    ConnectionHealth disconnected(String reason, long now) {
        return new ConnectionHealth(serverId, false, reason == null ? lastError : reason, retryCount,
            lastRetryTimestamp, consecutiveFailures, successfulCalls, failedCalls, now);
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("serverId", serverId)
            .put("connected", connected)
            .put("healthy", isHealthy())
            .put("lastError", lastError)
            .put("retryCount", retryCount)
            .put("lastRetryTimestamp", lastRetryTimestamp)
            .put("consecutiveFailures", consecutiveFailures)
            .put("successfulCalls", successfulCalls)
            .put("failedCalls", failedCalls)
            .put("lastUpdated", lastUpdated);
    }

    @Override
    public String toString() {
        return "ConnectionHealth{serverId='" + serverId + "', connected=" + connected
            + ", retryCount=" + retryCount + ", lastError=" + lastError + "}";
    }
}
