package com.deepansh.kernel.guard;

import com.deepansh.kernel.config.KernelProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Repetition detector for one run. Not thread-safe: a run checks its calls
 * sequentially, in issue order, before any of them is dispatched.
 *
 * Calls are identified by a SHA-256 of the tool name and the canonical JSON of the
 * parameters (object keys sorted at every depth), so key order never matters and
 * different parameters are never conflated.
 */
@Slf4j
public class LoopGuard {

    private final KernelProperties.LoopGuard config;
    private final ObjectMapper objectMapper;
    private final Map<String, Integer> repetitions = new HashMap<>();
    private int totalCalls;

    public LoopGuard(KernelProperties.LoopGuard config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    public LoopGuardVerdict check(String toolName, Map<String, Object> params) {
        String signature = signature(toolName, params);
        int count = repetitions.merge(signature, 1, Integer::sum);
        totalCalls++;

        if (totalCalls > config.getMaxTotalCalls()) {
            log.warn("Loop guard circuit break: {} tool calls in one run (limit {})",
                    totalCalls, config.getMaxTotalCalls());
            return LoopGuardVerdict.CIRCUIT_BREAK;
        }
        if (count >= config.getBlockThreshold()) {
            log.info("Loop guard blocked [{}] after {} identical calls", toolName, count);
            return LoopGuardVerdict.BLOCK;
        }
        if (count >= config.getWarnThreshold()) {
            return LoopGuardVerdict.WARN;
        }
        return LoopGuardVerdict.ALLOW;
    }

    public int repetitions(String toolName, Map<String, Object> params) {
        return repetitions.getOrDefault(signature(toolName, params), 0);
    }

    public int totalCalls() {
        return totalCalls;
    }

    public String signature(String toolName, Map<String, Object> params) {
        JsonNode tree = objectMapper.valueToTree(params != null ? params : Map.of());
        String canonical = canonicalize(tree).toString();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(toolName.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sorted.put(field.getKey(), canonicalize(field.getValue()));
            }
            ObjectNode out = objectMapper.createObjectNode();
            sorted.forEach(out::set);
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = objectMapper.createArrayNode();
            node.forEach(element -> out.add(canonicalize(element)));
            return out;
        }
        return node;
    }
}
