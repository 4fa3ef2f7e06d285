package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.tool.AgentTool;
import com.deepansh.kernel.tool.ShellRunner;
import com.deepansh.kernel.tool.ToolContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs a program in the workspace directory. No shell is involved; the command
 * string is split on whitespace into argv. Requires ShellExec matching the
 * full command line, e.g. {@code ShellExec("git *")}.
 */
@Component
public class ShellExecTool implements AgentTool {

    private final ShellRunner runner;

    public ShellExecTool(ShellRunner runner) {
        this.runner = runner;
    }

    @Override
    public String getName() {
        return "shell_exec";
    }

    @Override
    public String getDescription() {
        return """
                Run a command in the agent workspace and return its exit code and output.
                No shell features: pipes, redirection and globbing are not interpreted.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "command", Map.of("type", "string", "description", "Program and arguments, e.g. 'git status'"),
                        "args", Map.of("type", "array", "items", Map.of("type", "string"),
                                "description", "Extra arguments passed verbatim, for values containing spaces")
                ),
                "required", List.of("command")
        );
    }

    @Override
    public List<Capability> requiredCapabilities(Map<String, Object> arguments) {
        return List.of(Capability.shellExec(ShellRunner.commandLine(argv(arguments))));
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
        ShellRunner.Result result = runner.run(argv(arguments));
        if (result.timedOut()) {
            throw new IllegalStateException("Command timed out. Partial output:\n" + result.output());
        }
        return "exit=" + result.exitCode() + "\n" + result.output();
    }

    private List<String> argv(Map<String, Object> arguments) {
        return ShellRunner.argv(ToolArgs.required(arguments, "command"), ToolArgs.list(arguments, "args"));
    }
}
