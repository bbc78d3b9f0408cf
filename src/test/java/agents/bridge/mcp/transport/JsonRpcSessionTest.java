package agents.bridge.mcp.transport;

import agents.bridge.BridgeContext;
import agents.bridge.exception.ConnectionException;
import agents.bridge.exception.McpErrorException;
import agents.bridge.exception.RequestTimeoutException;
import agents.bridge.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class JsonRpcSessionTest {

    private final List<JsonObject> written = new CopyOnWriteArrayList<>();
    private JsonRpcSession session;

    @BeforeEach
    void setUp(Vertx vertx) {
        written.clear();
        session = new JsonRpcSession(new BridgeContext(vertx, LogUtil.DEBUG), "test", new RequestIdSequence());
        session.attach(message -> {
            written.add(message);
            return Future.succeededFuture();
        });
    }

    private static String reply(long id, JsonObject result) {
        return new JsonObject().put("jsonrpc", "2.0").put("id", id).put("result", result).encode();
    }

    @Test
    @DisplayName("Requests get increasing ids and replies are matched by id in any order")
    void outOfOrderReplies(VertxTestContext testContext) {
        Future<JsonObject> first = session.request("tools/call", new JsonObject().put("n", 1), 5000);
        Future<JsonObject> second = session.request("tools/call", new JsonObject().put("n", 2), 5000);

        long firstId = written.get(0).getLong("id");
        long secondId = written.get(1).getLong("id");
        assertTrue(secondId > firstId);
        assertEquals("2.0", written.get(0).getString("jsonrpc"));

        session.handleLine(reply(secondId, new JsonObject().put("value", "second")));
        session.handleLine(reply(firstId, new JsonObject().put("value", "first")));

        Future.all(first, second).onComplete(testContext.succeeding(cf -> testContext.verify(() -> {
            assertEquals("first", first.result().getString("value"));
            assertEquals("second", second.result().getString("value"));
            assertEquals(0, session.pendingCount());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("A timed out request is removed and a late reply is ignored")
    void timeoutRemovesPending(VertxTestContext testContext) {
        session.request("tools/call", new JsonObject(), 100).onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(RequestTimeoutException.class, err);
            long id = written.get(0).getLong("id");
            assertFalse(session.isPending(id));
            assertEquals(0, session.pendingCount());
            session.handleLine(reply(id, new JsonObject()));
            assertEquals(0, session.pendingCount());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Close rejects every outstanding request")
    void closeRejectsPending(VertxTestContext testContext) {
        Future<JsonObject> a = session.request("tools/call", new JsonObject(), 5000);
        Future<JsonObject> b = session.request("resources/list", new JsonObject(), 5000);
        assertEquals(2, session.pendingCount());

        session.close("process exited");

        Future.join(a, b).onComplete(ar -> testContext.verify(() -> {
            assertTrue(a.failed());
            assertTrue(b.failed());
            assertInstanceOf(ConnectionException.class, a.cause());
            assertEquals("Connection closed: process exited", a.cause().getMessage());
            assertEquals(0, session.pendingCount());
            assertTrue(session.isClosed());
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("Requests after close fail without being written")
    void requestAfterClose(VertxTestContext testContext) {
        session.close(null);
        session.request("tools/list", new JsonObject(), 1000).onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(ConnectionException.class, err);
            assertTrue(written.isEmpty());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Unparseable lines are dropped and the stream keeps working")
    void malformedLineDiscarded(VertxTestContext testContext) {
        Future<JsonObject> pending = session.request("tools/list", new JsonObject(), 5000);
        long id = written.get(0).getLong("id");

        session.handleLine("Server starting on stdio...");
        session.handleLine("{\"jsonrpc\":\"2.0\",\"id\":");
        session.handleLine("   ");
        assertTrue(session.isPending(id));

        session.handleLine(reply(id, new JsonObject().put("tools", new io.vertx.core.json.JsonArray())));
        pending.onComplete(testContext.succeeding(result -> testContext.verify(() -> {
            assertTrue(result.containsKey("tools"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Error replies fail the request with the remote code")
    void errorReply(VertxTestContext testContext) {
        Future<JsonObject> pending = session.request("tools/call", new JsonObject(), 5000);
        long id = written.get(0).getLong("id");
        session.handleLine(new JsonObject().put("jsonrpc", "2.0").put("id", id)
            .put("error", new JsonObject().put("code", -32602).put("message", "Invalid params")).encode());

        pending.onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(McpErrorException.class, err);
            assertEquals(-32602, ((McpErrorException) err).getErrorCode());
            assertEquals("MCP Error: Invalid params", err.getMessage());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Error replies with a non-numeric code still settle the request")
    void errorReplyWithStringCode(VertxTestContext testContext) {
        Future<JsonObject> pending = session.request("tools/call", new JsonObject(), 1000);
        long id = written.get(0).getLong("id");
        String line = new JsonObject().put("jsonrpc", "2.0").put("id", id)
            .put("error", new JsonObject().put("code", "E_BAD").put("message", "boom")).encode();

        assertDoesNotThrow(() -> session.handleLine(line));
        assertEquals(0, session.pendingCount());
        pending.onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(McpErrorException.class, err);
            assertEquals(-32603, ((McpErrorException) err).getErrorCode());
            assertEquals("MCP Error: boom", err.getMessage());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Reply ids sent as strings still match")
    void stringIdReply(VertxTestContext testContext) {
        Future<JsonObject> pending = session.request("ping", new JsonObject(), 5000);
        long id = written.get(0).getLong("id");
        session.handleLine(new JsonObject().put("jsonrpc", "2.0").put("id", String.valueOf(id))
            .put("result", new JsonObject()).encode());
        pending.onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Server ping is answered and other server requests get method-not-found")
    void serverRequests() {
        session.handleLine("{\"jsonrpc\":\"2.0\",\"id\":\"s1\",\"method\":\"ping\"}");
        session.handleLine("{\"jsonrpc\":\"2.0\",\"id\":\"s2\",\"method\":\"sampling/createMessage\",\"params\":{}}");

        assertEquals(2, written.size());
        assertEquals("s1", written.get(0).getValue("id"));
        assertEquals(new JsonObject(), written.get(0).getJsonObject("result"));
        assertEquals("s2", written.get(1).getValue("id"));
        assertEquals(-32601, written.get(1).getJsonObject("error").getInteger("code"));
    }

    @Test
    @DisplayName("Notifications reach the notification handler")
    void notificationsForwarded() {
        AtomicReference<JsonObject> seen = new AtomicReference<>();
        session.setNotificationHandler(seen::set);
        session.handleLine("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/tools/list_changed\"}");

        assertNotNull(seen.get());
        assertEquals("notifications/tools/list_changed", seen.get().getString("method"));
        assertTrue(written.isEmpty());
    }

    @Test
    @DisplayName("A failed write removes the request immediately")
    void writeFailure(VertxTestContext testContext) {
        session.attach(message -> Future.failedFuture(new java.io.IOException("Broken pipe")));
        session.request("tools/list", new JsonObject(), 5000).onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(ConnectionException.class, err);
            assertTrue(err.getMessage().contains("Broken pipe"));
            assertEquals(0, session.pendingCount());
            testContext.completeNow();
        })));
    }
}
