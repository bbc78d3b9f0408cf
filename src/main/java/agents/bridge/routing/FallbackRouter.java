package agents.bridge.routing;

import agents.bridge.mcp.base.ToolDefinition;
import agents.bridge.mcp.discovery.ServerCatalog;
import agents.bridge.mcp.discovery.ServerCatalogEntry;
import agents.bridge.routing.KeywordRule.ToolChoice;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic routing used when no LLM is configured or the LLM answer is unusable.
 *
 * <p>Rules are tried in order (filesystem, version control, web search, database). The first
 * rule whose trigger words appear in the query and that finds a suitable tool on a connected
 * server wins. Without a match the first tool of the first connected server is returned at
 * confidence {@value #LOW_CONFIDENCE}; with no connected server, an empty plan at 0.</p>
 */
public class FallbackRouter {

    public static final double LOW_CONFIDENCE = 0.2;

    private static final Pattern PATH_AFTER_VERB = Pattern.compile("(?:read|open|cat)\\s+([^\\s]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEARCH_TERM = Pattern.compile(
        "(?:search(?:\\s+the\\s+web)?(?:\\s+for)?|look\\s?up|google|find(?:\\s+information)?(?:\\s+(?:about|on|for))?)\\s+(.+)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private final List<KeywordRule> rules;

    public FallbackRouter() {
        this(standardRules());
    }

    public FallbackRouter(List<KeywordRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public RoutingPlan route(String query, ServerCatalog catalog) {
        String lower = query.toLowerCase(Locale.ROOT);
        List<ServerCatalogEntry> connected = catalog.getConnectedEntries();

        for (KeywordRule rule : rules) {
            if (!rule.triggeredBy(lower)) {
                continue;
            }
            for (ServerCatalogEntry entry : connected) {
                if (!rule.appliesTo(entry)) {
                    continue;
                }
                Optional<RoutingPlan> plan = rule.plan(query, entry);
                if (plan.isPresent()) {
                    return plan.get();
                }
            }
        }

        for (ServerCatalogEntry entry : connected) {
            if (!entry.getTools().isEmpty()) {
                ToolDefinition first = entry.getTools().get(0);
                return new RoutingPlan("Unknown", entry.getServerId(), first.getName(), new JsonObject(),
                    "No heuristic matched; defaulting to the first available tool", LOW_CONFIDENCE);
            }
        }
        return RoutingPlan.none("No suitable server/tool found");
    }

    /**
     * The built-in rule set.
     */
    public static List<KeywordRule> standardRules() {
        KeywordRule filesystem = new KeywordRule(
            "Filesystem operation",
            entry -> entry.getServerId().equals("filesystem") || entry.getServerId().contains("file"),
            List.of("file", "directory", "folder", "read ", "write", "list", "open ", "cat "),
            List.of(
                new ToolChoice(List.of("read", "open", "cat "), "read_file", FallbackRouter::pathParameters),
                new ToolChoice(List.of("tree", "structure", "hierarchy"), "directory_tree", q -> currentPath()),
                new ToolChoice(List.of("find", "search", "locate"), "search_files",
                    q -> currentPath().put("pattern", searchTerm(q))),
                new ToolChoice(List.of("info", "details", "size"), "get_file_info", FallbackRouter::pathParameters),
                new ToolChoice(List.of(), "list_directory", q -> currentPath())),
            0.5);

        KeywordRule git = new KeywordRule(
            "Version control operation",
            entry -> entry.getServerId().contains("git"),
            List.of("git", "commit", "branch", "diff", "repository", "repo "),
            List.of(
                new ToolChoice(List.of("status", "changes", "state"), "git_status", q -> repoPath()),
                new ToolChoice(List.of("log", "history", "commit"), "git_log", q -> repoPath()),
                new ToolChoice(List.of("diff", "difference", "compare"), "git_diff", q -> repoPath()),
                new ToolChoice(List.of("diff", "difference", "compare"), "git_diff_unstaged", q -> repoPath()),
                new ToolChoice(List.of(), "git_status", q -> repoPath())),
            0.6);

        KeywordRule webSearch = new KeywordRule(
            "Web search",
            entry -> entry.getServerId().equals("web-search") || entry.getServerId().contains("search"),
            List.of("search", "web", "google", "look up", "lookup", "online", "internet", "find information"),
            List.of(
                new ToolChoice(List.of(), "web_search", q -> new JsonObject().put("query", searchTerm(q))),
                new ToolChoice(List.of(), "brave_web_search", q -> new JsonObject().put("query", searchTerm(q))),
                new ToolChoice(List.of(), "search", q -> new JsonObject().put("query", searchTerm(q)))),
            0.6);

        KeywordRule database = new KeywordRule(
            "Database query",
            entry -> {
                String id = entry.getServerId();
                return id.contains("database") || id.contains("db") || id.contains("sql") || id.contains("postgres");
            },
            List.of("database", "sql", "table", "query", "select ", "rows"),
            List.of(
                new ToolChoice(List.of("tables", "schema"), "list_tables", q -> new JsonObject()),
                new ToolChoice(List.of(), "query", q -> new JsonObject().put("query", q)),
                new ToolChoice(List.of(), "read_query", q -> new JsonObject().put("query", q)),
                new ToolChoice(List.of(), "execute_query", q -> new JsonObject().put("query", q))),
            0.5);

        return List.of(filesystem, git, webSearch, database);
    }

    static JsonObject pathParameters(String query) {
        Matcher matcher = PATH_AFTER_VERB.matcher(query);
        if (matcher.find()) {
            return new JsonObject().put("path", matcher.group(1));
        }
        return currentPath();
    }

    static String searchTerm(String query) {
        Matcher quoted = QUOTED.matcher(query);
        if (quoted.find()) {
            return quoted.group(1);
        }
        Matcher matcher = SEARCH_TERM.matcher(query);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return query.trim();
    }

    private static JsonObject currentPath() {
        return new JsonObject().put("path", ".");
    }

    private static JsonObject repoPath() {
        return new JsonObject().put("repo_path", ".");
    }
}
