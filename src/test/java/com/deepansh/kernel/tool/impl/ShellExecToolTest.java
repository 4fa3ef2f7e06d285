package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.tool.ShellRunner;
import com.deepansh.kernel.tool.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class ShellExecToolTest {

    private static final ToolContext CONTEXT = new ToolContext("agent", "session", 0);

    @TempDir
    Path tempDir;

    private KernelProperties props;
    private ShellExecTool tool;

    @BeforeEach
    void setUp() {
        props = new KernelProperties();
        props.getTools().getFiles().setBaseDirectory(tempDir.toString());
        tool = new ShellExecTool(new ShellRunner(props));
    }

    @Test
    void execute_returnsExitCodeAndOutput() throws Exception {
        String result = tool.execute(Map.of("command", "echo", "args", List.of("hello", "shell")), CONTEXT);
        assertThat(result).isEqualTo("exit=0\nhello shell\n");
    }

    @Test
    void execute_nonZeroExit_isReported() throws Exception {
        assertThat(tool.execute(Map.of("command", "false"), CONTEXT)).startsWith("exit=1");
    }

    @Test
    void execute_overTimeout_fails() {
        props.getTools().getShell().setTimeoutMs(200);

        assertThatThrownBy(() -> tool.execute(Map.of("command", "sleep 5"), CONTEXT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void requiredCapabilities_coverFullCommandLine() {
        assertThat(tool.requiredCapabilities(Map.of("command", "git status", "args", List.of("--short"))))
                .containsExactly(Capability.shellExec("git status --short"));
    }
}
