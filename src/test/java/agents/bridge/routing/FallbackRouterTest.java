package agents.bridge.routing;

import agents.bridge.mcp.discovery.ServerCatalog;
import agents.bridge.mcp.discovery.ServerStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FallbackRouterTest {

    private final FallbackRouter router = new FallbackRouter();

    private static final ServerCatalog STANDARD = Catalogs.of(
        Catalogs.connected("filesystem", "list_directory", "read_file", "search_files", "directory_tree"),
        Catalogs.connected("git", "git_status", "git_log", "git_diff"),
        Catalogs.connected("web-search", "web_search"));

    @Test
    @DisplayName("Git keywords route to the git server")
    void gitStatus() {
        RoutingPlan plan = router.route("show git status", STANDARD);
        assertEquals("git", plan.getSelectedServer());
        assertEquals("git_status", plan.getSelectedTool());
        assertEquals(0.6, plan.getConfidence(), 1e-9);
        assertEquals(".", plan.getParameters().getString("repo_path"));
        assertEquals("Fallback heuristic analysis", plan.getReasoning());
    }

    @Test
    void gitHistory() {
        RoutingPlan plan = router.route("show the git history", STANDARD);
        assertEquals("git_log", plan.getSelectedTool());
    }

    @Test
    @DisplayName("Reading a file extracts the path after the verb")
    void readFileExtractsPath() {
        RoutingPlan plan = router.route("read package.json", STANDARD);
        assertEquals("filesystem", plan.getSelectedServer());
        assertEquals("read_file", plan.getSelectedTool());
        assertEquals("package.json", plan.getParameters().getString("path"));
        assertEquals(0.5, plan.getConfidence(), 1e-9);
    }

    @Test
    void listFilesDefaultsToCurrentDirectory() {
        RoutingPlan plan = router.route("list files", STANDARD);
        assertEquals("list_directory", plan.getSelectedTool());
        assertEquals(".", plan.getParameters().getString("path"));
    }

    @Test
    void directoryTree() {
        assertEquals("directory_tree", router.route("show the folder structure", STANDARD).getSelectedTool());
    }

    @Test
    @DisplayName("Web searches pass the search term as the query")
    void webSearch() {
        RoutingPlan plan = router.route("search the web for vertx event bus", STANDARD);
        assertEquals("web-search", plan.getSelectedServer());
        assertEquals("web_search", plan.getSelectedTool());
        assertEquals("vertx event bus", plan.getParameters().getString("query"));
    }

    @Test
    void quotedSearchTermWins() {
        assertEquals("TODO", FallbackRouter.searchTerm("find files containing \"TODO\" please"));
    }

    @Test
    @DisplayName("A rule is skipped when its server lacks every matching tool")
    void ruleNeedsMatchingTool() {
        ServerCatalog catalog = Catalogs.of(
            Catalogs.connected("git", "git_commit"),
            Catalogs.connected("web-search", "web_search"));
        RoutingPlan plan = router.route("google git tutorials", catalog);
        assertEquals("web-search", plan.getSelectedServer());
    }

    @Test
    @DisplayName("Unmatched queries default to the first tool at low confidence")
    void unmatchedQuery() {
        ServerCatalog catalog = Catalogs.of(Catalogs.connected("weather", "forecast", "alerts"));
        RoutingPlan plan = router.route("will it rain tomorrow", catalog);
        assertEquals("weather", plan.getSelectedServer());
        assertEquals("forecast", plan.getSelectedTool());
        assertEquals(FallbackRouter.LOW_CONFIDENCE, plan.getConfidence(), 1e-9);
        assertFalse(plan.isActionable(0.3));
    }

    @Test
    @DisplayName("Disconnected servers are never selected")
    void disconnectedServersIgnored() {
        ServerCatalog catalog = Catalogs.of(Catalogs.entry("filesystem", ServerStatus.DISCONNECTED, "list_directory"));
        RoutingPlan plan = router.route("list files", catalog);
        assertTrue(plan.isEmpty());
        assertEquals(0, plan.getConfidence(), 1e-9);
    }

    @Test
    void emptyCatalog() {
        RoutingPlan plan = router.route("anything", ServerCatalog.empty());
        assertTrue(plan.isEmpty());
        assertEquals("No suitable server/tool found", plan.getReasoning());
    }
}
