package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.tool.AgentTool;
import com.deepansh.kernel.tool.ToolContext;
import com.deepansh.kernel.tool.WorkspaceFiles;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class FileWriteTool implements AgentTool {

    private final WorkspaceFiles files;

    public FileWriteTool(WorkspaceFiles files) {
        this.files = files;
    }

    @Override
    public String getName() {
        return "file_write";
    }

    @Override
    public String getDescription() {
        return """
                Write or append text to a file in the agent workspace. Parent directories
                are created as needed. Set append=true to add to the end of an existing file.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of("type", "string", "description", "File path, e.g. 'notes/today.md'"),
                        "content", Map.of("type", "string", "description", "Text to write"),
                        "append", Map.of("type", "boolean", "description", "Append instead of overwrite. Default: false")
                ),
                "required", List.of("path", "content")
        );
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return List.of(Capability.fileWrite(files.capabilityPath(ToolArgs.required(arguments, "path"))));
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        String path = ToolArgs.required(arguments, "path");
        Object content = arguments.get("content");
        if (content == null) {
            throw new IllegalArgumentException("'content' is required");
        }
        boolean append = ToolArgs.flag(arguments, "append");
        int bytes = files.write(path, content.toString(), append);
        return String.format("%s %d bytes to '%s'", append ? "Appended" : "Wrote", bytes, path);
    }
}
