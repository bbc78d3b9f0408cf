package agents.bridge.mcp.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Example phrases for well-known tools, used to help the router match queries.
 */
public final class ToolExamples {

    private static final Map<String, List<String>> KNOWN = Map.ofEntries(
        Map.entry("list_directory", List.of("list files", "show directory contents", "ls")),
        Map.entry("read_file", List.of("read package.json", "show file contents", "cat readme.md")),
        Map.entry("write_file", List.of("write hello.txt with \"Hello World\"", "create new file", "save content to file")),
        Map.entry("search_files", List.of("find .ts files", "search for \"TODO\"", "locate specific files")),
        Map.entry("create_directory", List.of("create folder", "make directory", "mkdir new-folder")),
        Map.entry("move_file", List.of("move file to folder", "rename file", "relocate document")),
        Map.entry("get_file_info", List.of("file info", "file details", "check file size")),
        Map.entry("directory_tree", List.of("show file tree", "directory structure", "folder hierarchy")),

        Map.entry("git_status", List.of("git status", "check git state", "show changes")),
        Map.entry("git_log", List.of("git history", "commit log", "recent commits")),
        Map.entry("git_diff", List.of("show differences", "git diff", "compare changes")),

        Map.entry("web_search", List.of("search the web", "find information online", "google search")),
        Map.entry("search", List.of("search for information", "find content", "lookup"))
    );

    private ToolExamples() {
    }

    /**
     * Known examples for the tool, or generic ones derived from its name and description.
     */
    public static List<String> forTool(String toolName, String description) {
        List<String> known = KNOWN.get(toolName);
        if (known != null) {
            return known;
        }
        List<String> generic = new ArrayList<>();
        generic.add("use " + toolName);
        generic.add(toolName + " operation");
        String summary = description == null ? "" : description.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9\\s]", "")
            .trim();
        if (summary.length() > 20) {
            summary = summary.substring(0, 20);
        }
        if (!summary.isEmpty()) {
            generic.add(summary);
        }
        return generic;
    }
}
