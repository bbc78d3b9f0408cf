package agents.bridge.mcp.transport;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic JSON-RPC id source for one logical server.
 * Outlives individual connections so ids are never reused across reconnects.
 */
public class RequestIdSequence {

    private final AtomicLong next = new AtomicLong(1);

    public long next() {
        return next.getAndIncrement();
    }

    /** Id the next request will receive. */
    public long peek() {
        return next.get();
    }
}
