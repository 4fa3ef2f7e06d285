package com.deepansh.kernel.sandbox;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.memory.SharedMemory;
import com.deepansh.kernel.tool.ShellRunner;
import com.deepansh.kernel.tool.WorkspaceFiles;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Host functions reachable from sandboxed modules, by name.
 *
 * <pre>
 *   time_now                      always allowed
 *   fs_read  {path}               FileRead(/path)
 *   fs_write {path, content, append?}  FileWrite(/path)
 *   fs_list  {path?}              FileRead(/path)
 *   kv_get   {key}                MemoryRead(key)
 *   kv_set   {key, value}         MemoryWrite(key)
 *   shell_exec {command, args?}   ShellExec(command line)
 * </pre>
 */
@Component
@Slf4j
public class HostFunctionRegistry {

    private final Map<String, HostFunction> functions = new ConcurrentHashMap<>();
    private final WorkspaceFiles files;
    private final SharedMemory memory;
    private final ShellRunner shell;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public HostFunctionRegistry(WorkspaceFiles files, SharedMemory memory, ShellRunner shell,
                                Clock clock, ObjectMapper objectMapper) {
        this.files = files;
        this.memory = memory;
        this.shell = shell;
        this.clock = clock;
        this.objectMapper = objectMapper;
        registerCoreFunctions();
        log.info("Sandbox host functions registered: {}", functions.keySet());
    }

    public void register(HostFunction function) {
        functions.put(function.name(), function);
    }

    public Map<String, HostFunction> all() {
        return Map.copyOf(functions);
    }

    private void registerCoreFunctions() {
        register(HostFunction.unrestricted("time_now", params -> {
            Instant now = clock.instant();
            ObjectNode out = objectMapper.createObjectNode();
            out.put("epochMillis", now.toEpochMilli());
            out.put("iso", now.toString());
            return out;
        }));

        register(new HostFunction("fs_read",
                params -> List.of(Capability.fileRead(files.capabilityPath(text(params, "path")))),
                params -> TextNode.valueOf(files.read(text(params, "path")))));

        register(new HostFunction("fs_write",
                params -> List.of(Capability.fileWrite(files.capabilityPath(text(params, "path")))),
                params -> {
                    int bytes = files.write(text(params, "path"), text(params, "content"),
                            params.path("append").asBoolean(false));
                    return objectMapper.createObjectNode().put("bytes", bytes);
                }));

        register(new HostFunction("fs_list",
                params -> List.of(Capability.fileRead(files.capabilityPath(listPath(params)))),
                params -> objectMapper.valueToTree(files.list(listPath(params)))));

        register(new HostFunction("kv_get",
                params -> List.of(Capability.memoryRead(text(params, "key"))),
                params -> memory.get(text(params, "key"))
                        .<JsonNode>map(TextNode::valueOf)
                        .orElse(NullNode.getInstance())));

        register(new HostFunction("kv_set",
                params -> List.of(Capability.memoryWrite(text(params, "key"))),
                params -> {
                    JsonNode value = params.path("value");
                    memory.put(text(params, "key"), value.isTextual() ? value.asText() : value.toString());
                    return objectMapper.createObjectNode().put("stored", true);
                }));

        register(new HostFunction("shell_exec",
                params -> List.of(Capability.shellExec(ShellRunner.commandLine(argv(params)))),
                params -> {
                    ShellRunner.Result result = shell.run(argv(params));
                    ObjectNode out = objectMapper.createObjectNode();
                    out.put("exitCode", result.exitCode());
                    out.put("output", result.output());
                    out.put("timedOut", result.timedOut());
                    return out;
                }));
    }

    private List<String> argv(JsonNode params) {
        List<Object> args = new ArrayList<>();
        params.path("args").forEach(a -> args.add(a.asText()));
        return ShellRunner.argv(text(params, "command"), args);
    }

    private static String listPath(JsonNode params) {
        String path = params.path("path").asText("");
        return path.isBlank() ? "." : path;
    }

    private static String text(JsonNode params, String field) {
        JsonNode node = params.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
        return node.asText();
    }
}
