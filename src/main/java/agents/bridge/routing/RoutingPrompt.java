package agents.bridge.routing;

import agents.bridge.mcp.base.ToolDefinition;
import agents.bridge.mcp.discovery.ServerCatalog;
import agents.bridge.mcp.discovery.ServerCatalogEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the routing prompt: the connected servers with their tools and examples, then the query.
 */
public final class RoutingPrompt {

    private RoutingPrompt() {
    }

    public static String build(String query, ServerCatalog catalog) {
        return "You are an intelligent query router for MCP (Model Context Protocol) servers. "
            + "Your job is to analyze user queries and determine which MCP server and tool should handle the request.\n"
            + "\n"
            + "Available MCP Capabilities:\n"
            + capabilities(catalog) + "\n"
            + "\n"
            + "User Query: \"" + query + "\"\n"
            + "\n"
            + "Analyze this query and respond with a JSON object containing:\n"
            + "{\n"
            + "  \"intent\": \"Brief description of what the user wants to do\",\n"
            + "  \"selectedServer\": \"The server ID that should handle this request\",\n"
            + "  \"selectedTool\": \"The specific tool name to use\",\n"
            + "  \"parameters\": \"Object with parameters to pass to the tool\",\n"
            + "  \"reasoning\": \"Explanation of why you chose this server/tool\",\n"
            + "  \"confidence\": \"Number between 0-1 indicating confidence in this routing decision\"\n"
            + "}\n"
            + "\n"
            + "Important guidelines:\n"
            + "- Only use servers and tools that are listed in the available capabilities\n"
            + "- Extract specific parameters from the query (file paths, search terms, etc.)\n"
            + "- If the query is ambiguous, choose the most likely interpretation\n"
            + "- If no good match exists, set confidence to 0 and explain in reasoning\n"
            + "- For file operations, prefer filesystem servers\n"
            + "- For search operations, prefer search-capable servers\n"
            + "\n"
            + "Respond with only valid JSON.";
    }

    static String capabilities(ServerCatalog catalog) {
        List<String> sections = new ArrayList<>();
        for (ServerCatalogEntry server : catalog.getConnectedEntries()) {
            List<String> lines = new ArrayList<>();
            lines.add("Server: " + server.getName() + " (" + server.getServerId() + ")");
            lines.add("Description: " + server.getDescription());
            lines.add("Tools:");
            for (ToolDefinition tool : server.getTools()) {
                lines.add("  - " + tool.getName() + ": " + tool.getDescription());
                if (!tool.getExamples().isEmpty()) {
                    lines.add("    Examples: " + String.join(", ", tool.getExamples()));
                }
            }
            sections.add(String.join("\n", lines));
        }
        return String.join("\n\n", sections);
    }
}
