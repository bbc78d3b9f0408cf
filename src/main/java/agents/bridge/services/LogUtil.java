package agents.bridge.services;

import agents.bridge.BridgeContext;

/**
 * Leveled logging helpers. Records are published on the {@code log} event bus address
 * as {@code message,level,component,operation,category} and picked up by {@link Logger}.
 */
public final class LogUtil {

    public static final String LOG_ADDRESS = "log";

    // Log levels
    public static final int ERROR = 0;
    public static final int INFO = 1;
    public static final int DETAIL = 2;
    public static final int DEBUG = 3;
    public static final int DATA = 4;

    private LogUtil() {
    }

    public static void logError(BridgeContext ctx, String message, String component, String operation, String category) {
        publish(ctx, message, ERROR, component, operation, category);
    }

    /**
     * Log an error with exception details. The stack trace is only published at debug level.
     */
    public static void logError(BridgeContext ctx, String message, Throwable throwable,
                                String component, String operation, String category) {
        String fullMessage = throwable == null ? message : message + ": " + throwable.getMessage();
        publish(ctx, fullMessage, ERROR, component, operation, category);

        if (throwable != null && ctx.getLogLevel() >= DEBUG) {
            StringBuilder stackTrace = new StringBuilder();
            for (StackTraceElement element : throwable.getStackTrace()) {
                stackTrace.append(" at ").append(element);
            }
            publish(ctx, "Stack trace:" + stackTrace, DEBUG, component, operation, category);
        }
    }

    public static void logInfo(BridgeContext ctx, String message, String component, String operation, String category) {
        publish(ctx, message, INFO, component, operation, category);
    }

    public static void logDetail(BridgeContext ctx, String message, String component, String operation, String category) {
        publish(ctx, message, DETAIL, component, operation, category);
    }

    public static void logDebug(BridgeContext ctx, String message, String component, String operation, String category) {
        publish(ctx, message, DEBUG, component, operation, category);
    }

    public static void logData(BridgeContext ctx, String message, String component, String operation, String category) {
        publish(ctx, message, DATA, component, operation, category);
    }

    private static void publish(BridgeContext ctx, String message, int level,
                                String component, String operation, String category) {
        if (ctx == null || ctx.getVertx() == null || level > ctx.getLogLevel()) {
            return;
        }
        ctx.getVertx().eventBus().publish(LOG_ADDRESS, formatLogMessage(message, level, component, operation, category));
    }

    /**
     * Format a log record for the event bus
     */
    public static String formatLogMessage(String message, int level, String component, String operation, String category) {
        // Remove commas and line breaks so the record stays a single CSV row
        String cleanMessage = String.valueOf(message).replace(",", ";").replace("\n", " ").replace("\r", " ");
        return cleanMessage + "," + level + "," + component + "," + operation + "," + category;
    }
}
