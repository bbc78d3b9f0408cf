package agents.bridge.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.OpenOptions;

import java.util.LinkedList;

/**
 * Centralized log sink for the bridge.
 *
 * <p>Consumes CSV records from the {@code log} address, buffers them and appends them to
 * {@code <logsDir>/current.csv} every {@link #DEFAULT_FLUSH_INTERVAL_MS} ms. A message on
 * {@code log.flush} forces an immediate flush and is answered once the write completes.</p>
 */
public class Logger extends AbstractVerticle {

    public static final String FLUSH_ADDRESS = "log.flush";
    public static final String READY_ADDRESS = "logger.ready";

    private static final long DEFAULT_FLUSH_INTERVAL_MS = 5_000;
    private static final String HEADER = "Message,Level,Component,Operation,Category,SequenceReceived,EpochTimeMillis\n";

    private final String logsDir;
    private final String currentFile;
    private final long flushIntervalMs;
    private final int consoleLevel;

    private final LinkedList<String> buffer = new LinkedList<>();
    private int sequenceCounter = 0;
    private long flushTimerId = -1;

    public Logger(String logsDir) {
        this(logsDir, DEFAULT_FLUSH_INTERVAL_MS, LogUtil.ERROR);
    }

    /**
     * @param consoleLevel records at or below this level are echoed to the console, -1 disables echo
     */
    public Logger(String logsDir, long flushIntervalMs, int consoleLevel) {
        this.logsDir = logsDir;
        this.currentFile = logsDir + "/current.csv";
        this.flushIntervalMs = flushIntervalMs;
        this.consoleLevel = consoleLevel;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        vertx.fileSystem().mkdirs(logsDir)
            .compose(v -> vertx.fileSystem().exists(currentFile))
            .compose(exists -> exists
                ? Future.<Void>succeededFuture()
                : vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER)))
            .onSuccess(v -> {
                setupConsumers();
                flushTimerId = vertx.setPeriodic(flushIntervalMs, id -> flushBuffer());
                vertx.eventBus().publish(READY_ADDRESS, "true");
                startPromise.complete();
            })
            .onFailure(startPromise::fail);
    }

    private void setupConsumers() {
        vertx.eventBus().<String>consumer(LogUtil.LOG_ADDRESS, msg -> {
            String record = msg.body();
            sequenceCounter++;
            buffer.add(record + "," + sequenceCounter + "," + System.currentTimeMillis() + "\n");
            echo(record);
        });

        vertx.eventBus().consumer(FLUSH_ADDRESS, msg -> flushBuffer()
            .onComplete(ar -> msg.reply(ar.succeeded())));
    }

    private void echo(String record) {
        if (consoleLevel < 0 || record == null) {
            return;
        }
        String[] parts = record.split(",");
        if (parts.length < 2) {
            return;
        }
        try {
            int level = Integer.parseInt(parts[1].trim());
            if (level <= consoleLevel) {
                String line = "[" + (parts.length > 2 ? parts[2] : "?") + "] " + parts[0];
                if (level == LogUtil.ERROR) {
                    System.err.println(line);
                } else {
                    System.out.println(line);
                }
            }
        } catch (NumberFormatException e) {
            System.out.println(record);
        }
    }

    Future<Void> flushBuffer() {
        if (buffer.isEmpty()) {
            return Future.succeededFuture();
        }

        StringBuilder sb = new StringBuilder();
        buffer.forEach(sb::append);
        buffer.clear();

        return vertx.fileSystem().open(currentFile, new OpenOptions().setAppend(true).setCreate(true))
            .compose(file -> file.write(Buffer.buffer(sb.toString()))
                .compose(
                    v -> file.close(),
                    err -> file.close().compose(x -> Future.<Void>failedFuture(err))));
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (flushTimerId >= 0) {
            vertx.cancelTimer(flushTimerId);
        }
        flushBuffer().onComplete(ar -> stopPromise.complete());
    }
}
