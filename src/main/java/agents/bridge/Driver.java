package agents.bridge;

import agents.bridge.config.BridgeConfig;
import agents.bridge.config.ConfigLoader;
import agents.bridge.services.BridgeApiVerticle;
import agents.bridge.services.BridgeVerticle;
import agents.bridge.services.LogUtil;
import agents.bridge.services.Logger;
import io.github.cdimascio.dotenv.Dotenv;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

public class Driver {

  public static final Vertx vertx = Vertx.vertx(new VertxOptions()
      .setWorkerPoolSize(4)
      .setEventLoopPoolSize(2)
  );

  private static final String DATA_PATH = System.getProperty("mcp.bridge.data", BridgeContext.DEFAULT_DATA_PATH);
  private static final BridgeContext ctx = new BridgeContext(vertx, BridgeConfig.DEFAULT_LOG_LEVEL, DATA_PATH);

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final List<String> emergencyLogBuffer = Collections.synchronizedList(new LinkedList<>());
  private static volatile boolean loggerReady = false;

  /**
   * Publish a log record, or keep it in the emergency buffer (last 500 records) until the Logger is up.
   */
  public static void captureOrPublishLog(String message, int level, String operation) {
    if (level > ctx.getLogLevel()) {
      return;
    }
    String record = LogUtil.formatLogMessage(message, level, "Driver", operation, "System");
    if (!loggerReady) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.remove(0);
        }
        emergencyLogBuffer.add(record);
      }
    } else {
      vertx.eventBus().publish(LogUtil.LOG_ADDRESS, record);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish(LogUtil.LOG_ADDRESS, entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    captureOrPublishLog("=== MCP Bridge Starting ===", LogUtil.INFO, "StartUp");
    captureOrPublishLog("Java version: " + System.getProperty("java.version"), LogUtil.DETAIL, "StartUp");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir"), LogUtil.DETAIL, "StartUp");
    captureOrPublishLog("Data path: " + DATA_PATH, LogUtil.DETAIL, "StartUp");

    // Deploy Logger FIRST before anything else
    vertx.deployVerticle(new Logger(ctx.getLogsPath()))
        .onSuccess(id -> {
          loggerReady = true;
          flushEmergencyBuffer();
          captureOrPublishLog("Logger ready - emergency buffer flushed", LogUtil.DETAIL, "StartUp");
          loadEnvironment();
          new Driver().doIt(args.length > 0 ? args[0] : null);
        })
        .onFailure(err -> {
          System.err.println("FATAL: Logger deployment failed: " + err.getMessage());
          System.err.println("Cannot continue without logging capability");
          System.exit(1);
        });

    Runtime.getRuntime().addShutdownHook(new Thread(() -> vertx.close()
        .toCompletionStage().toCompletableFuture().join()));
  }

  private static void loadEnvironment() {
    try {
      Dotenv.configure()
          .filename(".env.local")
          .systemProperties()  // Load as system properties so ${NAME} placeholders can see them
          .ignoreIfMissing()
          .load();
      captureOrPublishLog("Loaded environment configuration from .env.local", LogUtil.DEBUG, "StartUp");
    } catch (Exception e) {
      // Continue anyway - not fatal
      captureOrPublishLog("Could not load .env.local file: " + e.getMessage(), LogUtil.ERROR, "StartUp");
      System.err.println("Warning: Could not load .env.local file: " + e.getMessage());
    }
  }

  private void doIt(String configPath) {
    ConfigLoader loader = new ConfigLoader(ctx);
    (configPath == null ? loader.load() : loader.load(configPath))
        .onSuccess(this::deployBridge)
        .onFailure(err -> {
          captureOrPublishLog("Invalid configuration: " + err.getMessage(), LogUtil.ERROR, "Config");
          System.err.println("Fatal error - invalid configuration: " + err.getMessage());
          vertx.close().onComplete(ar -> System.exit(1));
        });
  }

  private void deployBridge(BridgeConfig config) {
    ctx.setLogLevel(config.getLogLevel());
    captureOrPublishLog("Deploying MCP bridge with " + config.getEnabledServers().size() + " enabled servers",
        LogUtil.INFO, "StartUp");

    vertx.deployVerticle(new BridgeVerticle(ctx, config))
        .onSuccess(id -> {
          captureOrPublishLog("MCP bridge deployed", LogUtil.DEBUG, "StartUp");
          if (config.isHttpEnabled()) {
            deployApi(config.getHttpPort());
          } else {
            captureOrPublishLog("=== MCP Bridge Started ===", LogUtil.INFO, "StartUp");
          }
        })
        .onFailure(err -> {
          captureOrPublishLog("MCP bridge deployment failed: " + err.getMessage(), LogUtil.ERROR, "StartUp");
          System.err.println("Fatal error - MCP bridge deployment failed: " + err.getMessage());
        });
  }

  private void deployApi(int port) {
    vertx.deployVerticle(new BridgeApiVerticle(ctx, port))
        .onSuccess(id -> captureOrPublishLog("=== MCP Bridge Started (HTTP on port " + port + ") ===",
            LogUtil.INFO, "StartUp"))
        .onFailure(err -> {
          captureOrPublishLog("Bridge HTTP API deployment failed: " + err.getMessage(), LogUtil.ERROR, "StartUp");
          System.err.println("Bridge HTTP API deployment failed: " + err.getMessage());
        });
  }
}
