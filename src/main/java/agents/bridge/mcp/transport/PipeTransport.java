package agents.bridge.mcp.transport;

import agents.bridge.BridgeContext;
import agents.bridge.config.ServerConfig;
import agents.bridge.config.TransportKind;
import agents.bridge.exception.ConnectionException;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.core.parsetools.RecordParser;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static agents.bridge.services.LogUtil.*;

/**
 * Spawns the server as a child process and exchanges newline-delimited JSON-RPC over its stdio.
 *
 * <p>Each outbound message is one JSON object followed by a single {@code \n}. Inbound bytes are
 * split on newlines by a {@link RecordParser} running on the connecting context, so frames are
 * handled one at a time in arrival order. Blocking stream I/O runs on a dedicated worker pool.
 * stderr is logged and never parsed.</p>
 */
public class PipeTransport extends AbstractMcpTransport {

    public static final long GRACE_PERIOD_MS = 2000;
    private static final long EXIT_DRAIN_MS = 500;
    private static final int READ_BUFFER_SIZE = 8192;
    private static final int STDERR_TAIL_LINES = 20;
    private static final AtomicInteger EXECUTOR_COUNTER = new AtomicInteger();

    private final Deque<String> stderrTail = new ArrayDeque<>();

    private volatile Process process;
    private volatile OutputStream stdin;
    private volatile WorkerExecutor executor;
    private volatile Context context;

    public PipeTransport(BridgeContext ctx, ServerConfig config, JsonRpcSession session) {
        super(ctx, config, session);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.PIPE;
    }

    @Override
    protected Future<Void> openChannel() {
        context = ctx.getVertx().getOrCreateContext();
        executor = ctx.getVertx().createSharedWorkerExecutor(
            "mcp-pipe-" + config.getId() + "-" + EXECUTOR_COUNTER.incrementAndGet(), 4, 1, TimeUnit.DAYS);

        return executor.executeBlocking(this::startProcess, false)
            .map(started -> {
                if (isDisconnecting()) {
                    started.destroyForcibly();
                    throw new ConnectionException(config.getId(), "Process started after connect was abandoned", null);
                }
                process = started;
                stdin = started.getOutputStream();

                RecordParser parser = RecordParser.newDelimited("\n",
                    line -> session.handleLine(line.toString(StandardCharsets.UTF_8)));
                session.attach(this::writeMessage);

                readStdout(started.getInputStream(), parser);
                readStderr(started.getErrorStream());
                started.onExit().thenAccept(p -> context.runOnContext(v ->
                    ctx.getVertx().setTimer(EXIT_DRAIN_MS, t -> channelClosed(exitError(p)))));

                logDetail(ctx, "Started process " + config.getCommand() + " (pid " + started.pid() + ")",
                    "PipeTransport", "Spawn", config.getId());
                return null;
            });
    }

    private Process startProcess() throws IOException {
        List<String> command = new ArrayList<>();
        command.add(config.getCommand());
        command.addAll(config.getArgs());

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.environment().putAll(config.getEnv());
        if (config.getWorkingDirectory() != null && !config.getWorkingDirectory().isBlank()) {
            pb.directory(new File(config.getWorkingDirectory()));
        }
        return pb.start();
    }

    private void readStdout(InputStream in, RecordParser parser) {
        executor.executeBlocking(() -> {
            byte[] chunk = new byte[READ_BUFFER_SIZE];
            int n;
            while ((n = in.read(chunk)) != -1) {
                Buffer data = Buffer.buffer(Arrays.copyOf(chunk, n));
                context.runOnContext(v -> parser.handle(data));
            }
            return null;
        }, false).onComplete(ar -> ctx.getVertx().setTimer(EXIT_DRAIN_MS, t -> {
            // stdout usually hits EOF just before the exit status is available
            Process proc = process;
            if (proc != null && !proc.isAlive()) {
                channelClosed(exitError(proc));
            } else {
                channelClosed(new ConnectionException(config.getId(), "Process output closed", ar.cause()));
            }
        }));
    }

    private void readStderr(InputStream err) {
        executor.executeBlocking(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(err, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    rememberStderr(line);
                    logDetail(ctx, "stderr: " + line, "PipeTransport", "Stderr", config.getId());
                }
            }
            return null;
        }, false).onFailure(e -> logDebug(ctx, "stderr reader stopped: " + e.getMessage(),
            "PipeTransport", "Stderr", config.getId()));
    }

    private Future<Void> writeMessage(JsonObject message) {
        OutputStream out = stdin;
        WorkerExecutor pool = executor;
        if (out == null || pool == null) {
            return Future.failedFuture(new ConnectionException(config.getId(), "Process is not running", null));
        }
        byte[] frame = (message.encode() + "\n").getBytes(StandardCharsets.UTF_8);
        return pool.<Void>executeBlocking(() -> {
            synchronized (out) {
                out.write(frame);
                out.flush();
            }
            return null;
        }, true);
    }

    @Override
    protected Future<Void> closeChannel() {
        Process proc = process;
        if (proc == null) {
            closeExecutor();
            return Future.succeededFuture();
        }
        try {
            OutputStream out = stdin;
            if (out != null) {
                out.close();
            }
        } catch (IOException e) {
            logDebug(ctx, "Error closing stdin: " + e.getMessage(), "PipeTransport", "Close", config.getId());
        }
        if (!proc.isAlive()) {
            closeExecutor();
            return Future.succeededFuture();
        }

        proc.destroy();
        Promise<Void> exited = Promise.promise();
        long killTimer = ctx.getVertx().setTimer(GRACE_PERIOD_MS, t -> {
            if (proc.isAlive()) {
                logInfo(ctx, "Process did not exit within " + GRACE_PERIOD_MS + "ms, killing",
                    "PipeTransport", "Close", config.getId());
                proc.destroyForcibly();
            }
        });
        proc.onExit().thenAccept(p -> context.runOnContext(v -> {
            ctx.getVertx().cancelTimer(killTimer);
            exited.tryComplete();
        }));
        return exited.future().onComplete(ar -> closeExecutor());
    }

    private void closeExecutor() {
        WorkerExecutor pool = executor;
        if (pool != null) {
            executor = null;
            pool.close();
        }
    }

    private ConnectionException exitError(Process proc) {
        return new ConnectionException(config.getId(),
            "Process exited with code " + proc.exitValue() + lastStderrLine(), null);
    }

    private void rememberStderr(String line) {
        synchronized (stderrTail) {
            if (stderrTail.size() == STDERR_TAIL_LINES) {
                stderrTail.removeFirst();
            }
            stderrTail.addLast(line);
        }
    }

    private String lastStderrLine() {
        synchronized (stderrTail) {
            return stderrTail.isEmpty() ? "" : " (stderr: " + stderrTail.peekLast() + ")";
        }
    }

    /** Recent stderr lines, oldest first. */
    public List<String> getStderrTail() {
        synchronized (stderrTail) {
            return List.copyOf(stderrTail);
        }
    }

    /** Process id of the running child, or -1. */
    public long getPid() {
        Process proc = process;
        return proc == null ? -1 : proc.pid();
    }
}
