package com.deepansh.kernel.sandbox;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.support.InMemorySharedMemory;
import com.deepansh.kernel.tool.ShellRunner;
import com.deepansh.kernel.tool.WorkspaceFiles;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SandboxExecutorTest {

    private static final long MIB = 1024 * 1024;
    private static final SandboxBudget DEFAULT_BUDGET =
            new SandboxBudget(1_000_000, Duration.ofSeconds(20), 64 * MIB);

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HostFunctionRegistry hostFunctions;
    private SandboxExecutor executor;

    @BeforeEach
    void setUp() {
        KernelProperties properties = new KernelProperties();
        properties.getTools().getFiles().setBaseDirectory(tempDir.toString());
        hostFunctions = new HostFunctionRegistry(new WorkspaceFiles(properties), new InMemorySharedMemory(),
                new ShellRunner(properties), Clock.systemUTC(), objectMapper);
        executor = new SandboxExecutor(hostFunctions, objectMapper);
    }

    @Test
    void execute_returnsJsonOutput() throws Exception {
        SandboxOutput output = run("function execute(input) { return { sum: input.a + input.b }; }",
                objectMapper.readTree("{\"a\": 2, \"b\": 3}"), List.of(), DEFAULT_BUDGET);

        assertThat(output.output().path("sum").asInt()).isEqualTo(5);
    }

    @Test
    void infiniteLoop_exhaustsFuelBeforeTimeout() {
        SandboxBudget budget = new SandboxBudget(10_000, Duration.ofSeconds(30), 64 * MIB);
        long start = System.currentTimeMillis();

        assertThatThrownBy(() -> run("function execute(input) { var x = 0; while (true) { x++; } }",
                null, List.of(), budget))
                .isInstanceOf(SandboxException.class)
                .extracting(e -> ((SandboxException) e).getKind())
                .isEqualTo(SandboxErrorKind.FUEL_EXHAUSTED);
        assertThat(System.currentTimeMillis() - start).isLessThan(30_000);
    }

    @Test
    void blockedHostCall_isInterruptedByWallClock() {
        CountDownLatch never = new CountDownLatch(1);
        hostFunctions.register(HostFunction.unrestricted("block", params -> {
            never.await();
            return BooleanNode.TRUE;
        }));
        SandboxBudget budget = new SandboxBudget(0, Duration.ofMillis(500), 64 * MIB);
        long start = System.currentTimeMillis();

        assertThatThrownBy(() -> run("function execute(input) { return kernel.call('block', {}); }",
                null, List.of(), budget))
                .isInstanceOf(SandboxException.class)
                .extracting(e -> ((SandboxException) e).getKind())
                .isEqualTo(SandboxErrorKind.TIMEOUT);
        assertThat(System.currentTimeMillis() - start).isLessThan(10_000);
    }

    @Test
    void deniedHostCall_comesBackAsValue() throws Exception {
        Files.writeString(tempDir.resolve("secret.txt"), "s3cret", StandardCharsets.UTF_8);

        SandboxOutput output = run(
                "function execute(input) { return kernel.call('fs_read', { path: 'secret.txt' }); }",
                null, List.of(Capability.fileRead("/public/*")), DEFAULT_BUDGET);

        assertThat(output.output().path("denied").asBoolean()).isTrue();
        assertThat(output.output().path("error").asText()).contains("FILE_READ(/secret.txt)");
        assertThat(output.hostCalls()).isEqualTo(1);
    }

    @Test
    void grantedHostCall_readsWorkspaceFile() throws Exception {
        Files.writeString(tempDir.resolve("notes.txt"), "hello", StandardCharsets.UTF_8);

        SandboxOutput output = run(
                "function execute(input) { return kernel.call('fs_read', { path: 'notes.txt' }).ok.toUpperCase(); }",
                null, List.of(Capability.fileRead("/*")), DEFAULT_BUDGET);

        assertThat(output.output().asText()).isEqualTo("HELLO");
    }

    @Test
    void syntaxError_isCompilationFailure() {
        assertThatThrownBy(() -> run("function execute(input) { return ; ;; }}}", null, List.of(), DEFAULT_BUDGET))
                .isInstanceOf(SandboxException.class)
                .extracting(e -> ((SandboxException) e).getKind())
                .isEqualTo(SandboxErrorKind.COMPILATION);
    }

    @Test
    void missingEntryPoint_isAbiError() {
        assertThatThrownBy(() -> run("var notExecute = 1;", null, List.of(), DEFAULT_BUDGET))
                .isInstanceOf(SandboxException.class)
                .extracting(e -> ((SandboxException) e).getKind())
                .isEqualTo(SandboxErrorKind.ABI_ERROR);
    }

    @Test
    void guestThrow_isExecutionFailure() {
        assertThatThrownBy(() -> run("function execute(input) { throw new Error('boom'); }",
                null, List.of(), DEFAULT_BUDGET))
                .isInstanceOf(SandboxException.class)
                .hasMessageContaining("boom")
                .extracting(e -> ((SandboxException) e).getKind())
                .isEqualTo(SandboxErrorKind.EXECUTION);
    }

    @Test
    void manifestRequirementMissing_isDeniedBeforeRunning() {
        SandboxModule module = new SandboxModule("reporter", "", "function execute(i) { return 1; }",
                List.of(Capability.netConnect("api.example.com:443")), null);

        assertThatThrownBy(() -> executor.run(module, null, List.of(Capability.fileRead("*")), DEFAULT_BUDGET))
                .isInstanceOf(SandboxException.class)
                .extracting(e -> ((SandboxException) e).getKind())
                .isEqualTo(SandboxErrorKind.CAPABILITY_DENIED);
    }

    @Test
    void largeGuestAllocation_exceedsMemoryCeiling() {
        SandboxBudget budget = new SandboxBudget(1_000_000, Duration.ofSeconds(20), MIB);

        assertThatThrownBy(() -> run("""
                function execute(input) {
                  var a = new Array(20000000).fill(1.5);
                  var s = 'x'.repeat(50000000);
                  return { len: a.length + s.length };
                }
                """, null, List.of(), budget))
                .isInstanceOf(SandboxException.class)
                .extracting(e -> ((SandboxException) e).getKind())
                .isEqualTo(SandboxErrorKind.MEMORY_EXCEEDED);
    }

    @Test
    void memoryCeiling_holdsWhenGuestSwallowsHostCallFailure() {
        SandboxBudget budget = new SandboxBudget(1_000_000, Duration.ofSeconds(20), MIB);

        assertThatThrownBy(() -> run("""
                function execute(input) {
                  var chunks = [];
                  for (var i = 0; i < 64; i++) {
                    chunks.push(new Array(65536).fill(i));
                    try { kernel.call('time_now', {}); } catch (e) { }
                  }
                  return chunks.length;
                }
                """, null, List.of(), budget))
                .isInstanceOf(SandboxException.class)
                .extracting(e -> ((SandboxException) e).getKind())
                .isEqualTo(SandboxErrorKind.MEMORY_EXCEEDED);
    }

    @Test
    void hostIsNotReachable_fromGuest() throws Exception {
        SandboxOutput output = run("""
                function execute(input) {
                  return { host: typeof __host, kernel: typeof kernel.call };
                }
                """, null, List.of(), DEFAULT_BUDGET);

        JsonNode out = output.output();
        assertThat(out.path("host").asText()).isEqualTo("undefined");
        assertThat(out.path("kernel").asText()).isEqualTo("function");
    }

    private SandboxOutput run(String source, JsonNode input, List<Capability> grant, SandboxBudget budget) {
        return executor.run(source.getBytes(StandardCharsets.UTF_8), input, grant, budget);
    }
}
