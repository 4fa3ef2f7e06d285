package com.deepansh.kernel.tool.impl;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.support.InMemorySharedMemory;
import com.deepansh.kernel.tool.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryToolsTest {

    private static final ToolContext CONTEXT = new ToolContext("agent", "session", 0);

    private MemoryStoreTool storeTool;
    private MemoryRecallTool recallTool;

    @BeforeEach
    void setUp() {
        InMemorySharedMemory memory = new InMemorySharedMemory();
        storeTool = new MemoryStoreTool(memory);
        recallTool = new MemoryRecallTool(memory);
    }

    @Test
    void store_thenRecallByKey() {
        storeTool.execute(Map.of("key", "project/status", "value", "green"), CONTEXT);
        assertThat(recallTool.execute(Map.of("key", "project/status"), CONTEXT)).isEqualTo("green");
    }

    @Test
    void recall_unknownKey_saysSo() {
        assertThat(recallTool.execute(Map.of("key", "nope"), CONTEXT)).contains("No value stored");
    }

    @Test
    void recall_byPrefix_listsKeys() {
        storeTool.execute(Map.of("key", "project/a", "value", "1"), CONTEXT);
        storeTool.execute(Map.of("key", "project/b", "value", "2"), CONTEXT);
        storeTool.execute(Map.of("key", "other/c", "value", "3"), CONTEXT);

        assertThat(recallTool.execute(Map.of("prefix", "project/"), CONTEXT)).isEqualTo("project/a\nproject/b");
    }

    @Test
    void requiredCapabilities_scopeToKeyOrPrefix() {
        assertThat(storeTool.requiredCapabilities(Map.of("key", "k1", "value", "v")))
                .containsExactly(Capability.memoryWrite("k1"));
        assertThat(recallTool.requiredCapabilities(Map.of("key", "k1")))
                .containsExactly(Capability.memoryRead("k1"));
        assertThat(recallTool.requiredCapabilities(Map.of("prefix", "project/")))
                .containsExactly(Capability.memoryRead("project/*"));
    }
}
