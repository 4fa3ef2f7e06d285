package com.deepansh.kernel.guard;

import com.deepansh.kernel.config.KernelProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LoopGuardTest {

    private LoopGuard guard;

    @BeforeEach
    void setUp() {
        guard = new LoopGuardFactory(new KernelProperties(), new ObjectMapper()).newRun();
    }

    @Test
    void identicalCalls_escalateFromAllowToWarnToBlock() {
        Map<String, Object> params = Map.of("query", "x");

        assertThat(guard.check("search", params)).isEqualTo(LoopGuardVerdict.ALLOW);
        assertThat(guard.check("search", params)).isEqualTo(LoopGuardVerdict.ALLOW);
        assertThat(guard.check("search", params)).isEqualTo(LoopGuardVerdict.WARN);
        assertThat(guard.check("search", params)).isEqualTo(LoopGuardVerdict.WARN);
        assertThat(guard.check("search", params)).isEqualTo(LoopGuardVerdict.BLOCK);
        assertThat(guard.repetitions("search", params)).isEqualTo(5);
    }

    @Test
    void differentParameters_areCountedSeparately() {
        for (int i = 0; i < 4; i++) {
            guard.check("search", Map.of("query", "x"));
        }
        assertThat(guard.check("search", Map.of("query", "y"))).isEqualTo(LoopGuardVerdict.ALLOW);
    }

    @Test
    void sameToolDifferentName_isNotConflated() {
        for (int i = 0; i < 4; i++) {
            guard.check("search", Map.of("query", "x"));
        }
        assertThat(guard.check("lookup", Map.of("query", "x"))).isEqualTo(LoopGuardVerdict.ALLOW);
    }

    @Test
    void signature_ignoresKeyOrderAtEveryDepth() {
        Map<String, Object> inner1 = new LinkedHashMap<>();
        inner1.put("b", 2);
        inner1.put("a", 1);
        Map<String, Object> params1 = new LinkedHashMap<>();
        params1.put("opts", inner1);
        params1.put("path", "/x");

        Map<String, Object> inner2 = new LinkedHashMap<>();
        inner2.put("a", 1);
        inner2.put("b", 2);
        Map<String, Object> params2 = new LinkedHashMap<>();
        params2.put("path", "/x");
        params2.put("opts", inner2);

        assertThat(guard.signature("tool", params1)).isEqualTo(guard.signature("tool", params2));
    }

    @Test
    void signature_arrayOrderMatters() {
        assertThat(guard.signature("tool", Map.of("list", List.of(1, 2))))
                .isNotEqualTo(guard.signature("tool", Map.of("list", List.of(2, 1))));
    }

    @Test
    void totalCallsOverLimit_circuitBreaks() {
        for (int i = 0; i < 30; i++) {
            assertThat(guard.check("tool", Map.of("n", i))).isEqualTo(LoopGuardVerdict.ALLOW);
        }
        assertThat(guard.check("tool", Map.of("n", 30))).isEqualTo(LoopGuardVerdict.CIRCUIT_BREAK);
        assertThat(guard.totalCalls()).isEqualTo(31);
    }
}
