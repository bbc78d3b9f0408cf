package agents.bridge;

import io.vertx.core.Vertx;

/**
 * Runtime context handed to every engine component at construction time.
 * Carries the Vert.x instance used for I/O and timers and the active log level.
 */
public class BridgeContext {

    public static final String DEFAULT_DATA_PATH = "./data/bridge";

    private final Vertx vertx;
    private final String dataPath;
    private volatile int logLevel;

    public BridgeContext(Vertx vertx, int logLevel) {
        this(vertx, logLevel, DEFAULT_DATA_PATH);
    }

    public BridgeContext(Vertx vertx, int logLevel, String dataPath) {
        this.vertx = vertx;
        this.logLevel = logLevel;
        this.dataPath = dataPath;
    }

    public Vertx getVertx() {
        return vertx;
    }

    public int getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(int logLevel) {
        this.logLevel = logLevel;
    }

    public String getDataPath() {
        return dataPath;
    }

    public String getLogsPath() {
        return dataPath + "/logs";
    }
}
