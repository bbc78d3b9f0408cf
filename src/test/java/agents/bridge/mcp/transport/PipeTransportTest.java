package agents.bridge.mcp.transport;

import agents.bridge.BridgeContext;
import agents.bridge.config.ServerConfig;
import agents.bridge.exception.ConnectionException;
import agents.bridge.exception.RequestTimeoutException;
import agents.bridge.services.LogUtil;
import agents.bridge.testsupport.FakeToolServer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.Timeout;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the pipe transport against a real child JVM speaking newline-delimited JSON-RPC.
 */
@ExtendWith(VertxExtension.class)
@Timeout(value = 60, timeUnit = TimeUnit.SECONDS)
class PipeTransportTest {

    private PipeTransport transport;
    private JsonRpcSession session;

    private PipeTransport create(Vertx vertx, List<String> command) {
        BridgeContext ctx = new BridgeContext(vertx, LogUtil.DEBUG);
        ServerConfig config = ServerConfig.builder("fake")
            .command(command.get(0))
            .args(command.subList(1, command.size()))
            .enabled(true)
            .timeout(20000)
            .build();
        session = new JsonRpcSession(ctx, "fake", new RequestIdSequence());
        transport = new PipeTransport(ctx, config, session);
        return transport;
    }

    @AfterEach
    void tearDown(VertxTestContext testContext) {
        if (transport == null) {
            testContext.completeNow();
            return;
        }
        transport.disconnect().onComplete(ar -> testContext.completeNow());
    }

    @Test
    @DisplayName("Handshake, tool listing and a tool call over stdio")
    void connectAndCall(Vertx vertx, VertxTestContext testContext) {
        create(vertx, FakeToolServer.commandLine());
        transport.connect()
            .compose(v -> transport.listTools())
            .compose(tools -> {
                testContext.verify(() -> {
                    assertTrue(transport.isConnected());
                    assertEquals("fake", transport.getServerInfo().getJsonObject("serverInfo").getString("name"));
                    assertTrue(tools.stream().anyMatch(t -> t.getName().equals("echo")));
                    assertTrue(transport.getPid() > 0);
                });
                return transport.callTool("echo", new JsonObject().put("text", "hello"), 5000);
            })
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals("echo: hello", result.textContent());
                assertFalse(result.isError());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Non-JSON output lines are ignored")
    void noisyOutput(Vertx vertx, VertxTestContext testContext) {
        create(vertx, FakeToolServer.commandLine("--noise"));
        transport.connect()
            .compose(v -> transport.callTool("echo", new JsonObject().put("text", "still works"), 5000))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals("echo: still works", result.textContent());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Replies arriving out of order resolve the right requests")
    void outOfOrder(Vertx vertx, VertxTestContext testContext) {
        create(vertx, FakeToolServer.commandLine());
        List<String> completionOrder = new CopyOnWriteArrayList<>();
        transport.connect().onComplete(testContext.succeeding(v -> {
            Future<String> delayed = transport.callTool("delayed", new JsonObject().put("text", "a"), 5000)
                .map(r -> r.textContent())
                .onSuccess(completionOrder::add);
            Future<String> echo = transport.callTool("echo", new JsonObject().put("text", "b"), 5000)
                .map(r -> r.textContent())
                .onSuccess(completionOrder::add);
            Future.all(delayed, echo).onComplete(testContext.succeeding(cf -> testContext.verify(() -> {
                assertEquals("delayed: a", delayed.result());
                assertEquals("echo: b", echo.result());
                assertEquals(List.of("echo: b", "delayed: a"), completionOrder);
                testContext.completeNow();
            })));
        }));
    }

    @Test
    @DisplayName("A request without reply times out and leaves the connection usable")
    void timeout(Vertx vertx, VertxTestContext testContext) {
        create(vertx, FakeToolServer.commandLine());
        transport.connect()
            .compose(v -> transport.callTool("slow", new JsonObject(), 300))
            .onComplete(ar -> {
                testContext.verify(() -> {
                    assertTrue(ar.failed());
                    assertInstanceOf(RequestTimeoutException.class, ar.cause());
                    assertEquals(0, session.pendingCount());
                });
                transport.callTool("echo", new JsonObject().put("text", "after"), 5000)
                    .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                        assertEquals("echo: after", result.textContent());
                        testContext.completeNow();
                    })));
            });
    }

    @Test
    @DisplayName("Server notifications reach the session handler")
    void notifications(Vertx vertx, VertxTestContext testContext) {
        create(vertx, FakeToolServer.commandLine());
        List<JsonObject> notifications = new CopyOnWriteArrayList<>();
        session.setNotificationHandler(notifications::add);
        transport.connect()
            .compose(v -> transport.callTool("notify", new JsonObject(), 5000))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals("notified", result.textContent());
                assertEquals(1, notifications.size());
                assertEquals("notifications/message", notifications.get(0).getString("method"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Process exit rejects pending requests and fires the close handler")
    void processExit(Vertx vertx, VertxTestContext testContext) {
        create(vertx, FakeToolServer.commandLine());
        transport.closeHandler(err -> testContext.verify(() -> {
            assertFalse(transport.isConnected());
            assertTrue(err.getMessage().contains("exited with code 3"), err.getMessage());
            testContext.completeNow();
        }));
        transport.connect().onComplete(testContext.succeeding(v ->
            transport.callTool("crash", new JsonObject(), 10000).onComplete(ar -> testContext.verify(() -> {
                assertTrue(ar.failed());
                assertInstanceOf(ConnectionException.class, ar.cause());
            }))));
    }

    @Test
    @DisplayName("A command that cannot be started fails the connect")
    void spawnFailure(Vertx vertx, VertxTestContext testContext) {
        create(vertx, List.of("definitely-not-a-real-command-4711"));
        transport.connect().onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(ConnectionException.class, err);
            assertFalse(transport.isConnected());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Disconnect terminates the child process")
    void disconnectTerminates(Vertx vertx, VertxTestContext testContext) {
        create(vertx, FakeToolServer.commandLine());
        transport.connect().onComplete(testContext.succeeding(v -> {
            long pid = transport.getPid();
            transport.disconnect().onComplete(testContext.succeeding(done -> testContext.verify(() -> {
                assertFalse(ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false));
                assertFalse(transport.isConnected());
                assertTrue(session.isClosed());
                testContext.completeNow();
            })));
        }));
    }
}
