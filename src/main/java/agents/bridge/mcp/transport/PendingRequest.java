package agents.bridge.mcp.transport;

import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;

/**
 * An in-flight request awaiting its correlated reply.
 */
class PendingRequest {

    private final long id;
    private final String method;
    private final Promise<JsonObject> promise;
    private volatile long timerId = -1;

    PendingRequest(long id, String method, Promise<JsonObject> promise) {
        this.id = id;
        this.method = method;
        this.promise = promise;
    }

    long getId() {
        return id;
    }

    String getMethod() {
        return method;
    }

    long getTimerId() {
        return timerId;
    }

    void setTimerId(long timerId) {
        this.timerId = timerId;
    }

    void complete(JsonObject result) {
        promise.tryComplete(result);
    }

    void fail(Throwable cause) {
        promise.tryFail(cause);
    }
}
