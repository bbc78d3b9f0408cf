package agents.bridge.mcp.base;

import agents.bridge.exception.ProtocolException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Result of a {@code tools/call}: a content array plus an error flag.
 */
public class ToolResult {

    private final JsonArray content;
    private final boolean error;

    public ToolResult(JsonArray content, boolean error) {
        this.content = content == null ? new JsonArray() : content;
        this.error = error;
    }

    public static ToolResult fromJson(JsonObject result) {
        if (result == null) {
            return new ToolResult(new JsonArray(), false);
        }
        Object content = result.getValue("content");
        if (content != null && !(content instanceof JsonArray)) {
            throw new ProtocolException("Tool result content is not an array: " + content);
        }
        Object isError = result.getValue("isError");
        if (isError != null && !(isError instanceof Boolean)) {
            throw new ProtocolException("Tool result isError is not a boolean: " + isError);
        }
        return new ToolResult((JsonArray) content, Boolean.TRUE.equals(isError));
    }

    public JsonArray getContent() {
        return content;
    }

    public boolean isError() {
        return error;
    }

    /**
     * Concatenate the text items of the content array, one per line.
     * Non-text items are rendered as their JSON encoding.
     */
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < content.size(); i++) {
            Object item = content.getValue(i);
            if (sb.length() > 0) {
                sb.append('\n');
            }
            if (item instanceof JsonObject obj && "text".equals(obj.getString("type"))) {
                sb.append(obj.getValue("text") == null ? "" : String.valueOf(obj.getValue("text")));
            } else if (item instanceof JsonObject obj) {
                sb.append(obj.encode());
            } else {
                sb.append(item);
            }
        }
        return sb.toString();
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("content", content)
            .put("isError", error);
    }

    @Override
    public String toString() {
        return "ToolResult{isError=" + error + ", content=" + content + "}";
    }
}
