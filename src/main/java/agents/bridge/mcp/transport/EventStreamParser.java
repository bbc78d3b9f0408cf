package agents.bridge.mcp.transport;

import java.util.function.BiConsumer;

/**
 * Incremental {@code text/event-stream} decoder. Feed it lines; it emits (event, data)
 * pairs on each blank line. Multi-line data fields are joined with {@code \n}.
 */
public class EventStreamParser {

    private final BiConsumer<String, String> eventHandler;
    private final StringBuilder data = new StringBuilder();
    private String eventName;
    private boolean hasData = false;

    public EventStreamParser(BiConsumer<String, String> eventHandler) {
        this.eventHandler = eventHandler;
    }

    public void handleLine(String rawLine) {
        String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
        if (line.isEmpty()) {
            dispatch();
            return;
        }
        if (line.startsWith(":")) {
            return;
        }

        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }

        switch (field) {
            case "event" -> eventName = value;
            case "data" -> {
                if (hasData) {
                    data.append('\n');
                }
                data.append(value);
                hasData = true;
            }
            default -> {
                // id and retry are not used
            }
        }
    }

    private void dispatch() {
        if (hasData) {
            eventHandler.accept(eventName == null ? "message" : eventName, data.toString());
        }
        data.setLength(0);
        hasData = false;
        eventName = null;
    }
}
