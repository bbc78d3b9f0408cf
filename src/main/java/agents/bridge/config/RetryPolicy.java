package agents.bridge.config;

import io.vertx.core.json.JsonObject;

/**
 * Exponential backoff between connection attempts.
 */
public class RetryPolicy {

    public static final long DEFAULT_BASE_DELAY = 1000;
    public static final double DEFAULT_BACKOFF_FACTOR = 2;
    public static final long DEFAULT_MAX_DELAY = 30000;

    private final long baseDelay;
    private final double backoffFactor;
    private final long maxDelay;

    public RetryPolicy(long baseDelay, double backoffFactor, long maxDelay) {
        this.baseDelay = Math.max(0, baseDelay);
        this.backoffFactor = backoffFactor < 1 ? 1 : backoffFactor;
        this.maxDelay = Math.max(this.baseDelay, maxDelay);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_BASE_DELAY, DEFAULT_BACKOFF_FACTOR, DEFAULT_MAX_DELAY);
    }

    public static RetryPolicy fromJson(JsonObject json) {
        if (json == null) {
            return defaults();
        }
        return new RetryPolicy(
            json.getLong("baseDelay", DEFAULT_BASE_DELAY),
            json.getDouble("backoffFactor", DEFAULT_BACKOFF_FACTOR),
            json.getLong("maxDelay", DEFAULT_MAX_DELAY));
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one:
     * {@code min(maxDelay, baseDelay * backoffFactor^(attempt - 1))}.
     */
    public long delayAfterFailure(int attempt) {
        if (attempt < 1) {
            return 0;
        }
        double delay = baseDelay * Math.pow(backoffFactor, attempt - 1);
        return (long) Math.min(maxDelay, delay);
    }

    public long getBaseDelay() {
        return baseDelay;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public long getMaxDelay() {
        return maxDelay;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("baseDelay", baseDelay)
            .put("backoffFactor", backoffFactor)
            .put("maxDelay", maxDelay);
    }
}
