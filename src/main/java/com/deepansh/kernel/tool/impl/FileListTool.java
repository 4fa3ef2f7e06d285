package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.tool.AgentTool;
import com.deepansh.kernel.tool.ToolContext;
import com.deepansh.kernel.tool.WorkspaceFiles;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class FileListTool implements AgentTool {

    private final WorkspaceFiles files;

    public FileListTool(WorkspaceFiles files) {
        this.files = files;
    }

    @Override
    public String getName() {
        return "file_list";
    }

    @Override
    public String getDescription() {
        return "List files in a workspace directory (two levels deep). Omit 'path' for the workspace root.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of("type", "string", "description", "Directory, e.g. 'notes'")
                )
        );
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return List.of(Capability.fileRead(files.capabilityPath(directory(arguments))));
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        String dir = directory(arguments);
        List<String> entries = files.list(dir);
        if (entries.isEmpty()) {
            return "Directory not found or empty.";
        }
        return "Files in '" + dir + "':\n" + String.join("\n", entries);
    }

    private String directory(Map<String, Object> arguments) {
        String path = ToolArgs.optional(arguments, "path", "");
        return path.isBlank() ? "." : path;
    }
}
