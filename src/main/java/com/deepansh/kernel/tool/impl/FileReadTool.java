package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.tool.AgentTool;
import com.deepansh.kernel.tool.ToolContext;
import com.deepansh.kernel.tool.WorkspaceFiles;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class FileReadTool implements AgentTool {

    private final WorkspaceFiles files;

    public FileReadTool(WorkspaceFiles files) {
        this.files = files;
    }

    @Override
    public String getName() {
        return "file_read";
    }

    @Override
    public String getDescription() {
        return "Read a UTF-8 text file from the agent workspace. Paths are relative to the workspace root.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of("type", "string", "description", "File path, e.g. 'notes/today.md'")
                ),
                "required", List.of("path")
        );
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return List.of(Capability.fileRead(files.capabilityPath(ToolArgs.required(arguments, "path"))));
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        return files.read(ToolArgs.required(arguments, "path"));
    }
}
