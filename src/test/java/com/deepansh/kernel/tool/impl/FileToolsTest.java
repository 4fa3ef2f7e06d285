package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.tool.ToolContext;
import com.deepansh.kernel.tool.WorkspaceFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileToolsTest {

    private static final ToolContext CONTEXT = new ToolContext("agent", "session", 0);

    @TempDir
    Path tempDir;

    private FileReadTool readTool;
    private FileWriteTool writeTool;
    private FileListTool listTool;

    @BeforeEach
    void setUp() {
        KernelProperties props = new KernelProperties();
        props.getTools().getFiles().setBaseDirectory(tempDir.toString());
        props.getTools().getFiles().setMaxFileSizeKb(1);
        WorkspaceFiles files = new WorkspaceFiles(props);
        readTool = new FileReadTool(files);
        writeTool = new FileWriteTool(files);
        listTool = new FileListTool(files);
    }

    @Test
    void write_thenRead_roundTrips() throws Exception {
        writeTool.execute(Map.of("path", "test.txt", "content", "hello world"), CONTEXT);
        assertThat(readTool.execute(Map.of("path", "test.txt"), CONTEXT)).isEqualTo("hello world");
    }

    @Test
    void append_addsToExistingFile() throws Exception {
        writeTool.execute(Map.of("path", "notes.txt", "content", "line1\n"), CONTEXT);
        String result = writeTool.execute(Map.of("path", "notes.txt", "content", "line2\n", "append", true), CONTEXT);

        assertThat(result).startsWith("Appended 6 bytes");
        assertThat(readTool.execute(Map.of("path", "notes.txt"), CONTEXT)).isEqualTo("line1\nline2\n");
    }

    @Test
    void write_createsNestedDirectories() throws Exception {
        writeTool.execute(Map.of("path", "reports/2026/q1.md", "content", "# Q1"), CONTEXT);
        assertThat(tempDir.resolve("reports/2026/q1.md")).hasContent("# Q1");
    }

    @Test
    void list_showsWrittenFiles() throws Exception {
        writeTool.execute(Map.of("path", "a.md", "content", "# A"), CONTEXT);
        writeTool.execute(Map.of("path", "docs/b.txt", "content", "B"), CONTEXT);

        String result = listTool.execute(Map.of(), CONTEXT);

        assertThat(result).contains("a.md").contains("docs/b.txt");
    }

    @Test
    void list_missingDirectory_saysSo() throws Exception {
        assertThat(listTool.execute(Map.of("path", "nothing-here"), CONTEXT)).isEqualTo("Directory not found or empty.");
    }

    @Test
    void read_pathTraversal_isRejected() {
        assertThatThrownBy(() -> readTool.execute(Map.of("path", "../../etc/passwd"), CONTEXT))
                .isInstanceOf(SecurityException.class);
        assertThatThrownBy(() -> readTool.requiredCapabilities(Map.of("path", "../outside.txt")))
                .isInstanceOf(SecurityException.class);
    }

    @Test
    void read_nonExistentFile_fails() {
        assertThatThrownBy(() -> readTool.execute(Map.of("path", "ghost.txt"), CONTEXT))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void write_missingContent_fails() {
        assertThatThrownBy(() -> writeTool.execute(Map.of("path", "test.txt"), CONTEXT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("content");
    }

    @Test
    void write_overSizeLimit_fails() {
        assertThatThrownBy(() -> writeTool.execute(Map.of("path", "big.txt", "content", "x".repeat(2048)), CONTEXT))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("too large");
    }

    @Test
    void requiredCapabilities_useNormalizedWorkspacePath() {
        assertThat(readTool.requiredCapabilities(Map.of("path", "docs/./a.txt")))
                .containsExactly(Capability.fileRead("/docs/a.txt"));
        assertThat(writeTool.requiredCapabilities(Map.of("path", "/out/b.txt", "content", "x")))
                .containsExactly(Capability.fileWrite("/out/b.txt"));
        assertThat(listTool.requiredCapabilities(Map.of()))
                .containsExactly(Capability.fileRead("/"));
    }
}
