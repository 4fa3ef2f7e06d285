package com.deepansh.kernel.sandbox;

import com.deepansh.kernel.capability.Capability;
import com.deepansh.kernel.config.KernelProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Installed sandbox modules, exposed to agents as sandbox-kind tools.
 *
 * At startup every {@code *.js} file in {@code kernel.sandbox.modules-dir} is loaded.
 * An optional sibling {@code <name>.json} manifest supplies the description, input schema
 * and required capabilities:
 * <pre>
 * { "description": "...",
 *   "inputSchema": { "type": "object", ... },
 *   "requiredCapabilities": [ { "type": "FILE_READ", "value": "/reports/*" } ] }
 * </pre>
 * A module that fails to load is logged and skipped.
 */
@Component
@Slf4j
public class SandboxModuleRegistry {

    private final Map<String, SandboxModule> modules = new ConcurrentHashMap<>();
    private final KernelProperties.Sandbox config;
    private final ObjectMapper objectMapper;

    public SandboxModuleRegistry(KernelProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getSandbox();
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadInstalledModules() {
        String dir = config.getModulesDir();
        if (dir == null || dir.isBlank()) {
            log.info("No sandbox modules directory configured");
            return;
        }
        Path root = Paths.get(dir);
        if (!Files.isDirectory(root)) {
            log.warn("Sandbox modules directory does not exist: {}", root.toAbsolutePath());
            return;
        }
        try (Stream<Path> files = Files.list(root)) {
            files.filter(p -> p.getFileName().toString().endsWith(".js"))
                    .sorted()
                    .forEach(this::loadQuietly);
        } catch (IOException e) {
            log.error("Failed to scan sandbox modules directory {}", root, e);
        }
        log.info("Sandbox modules loaded: {}", modules.keySet());
    }

    public void register(SandboxModule module) {
        SandboxModule previous = modules.put(module.name(), module);
        if (previous != null) {
            log.info("Replaced sandbox module: {}", module.name());
        }
    }

    public Optional<SandboxModule> find(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    public Collection<SandboxModule> all() {
        return List.copyOf(modules.values());
    }

    SandboxModule load(Path sourceFile) throws IOException {
        String fileName = sourceFile.getFileName().toString();
        String name = fileName.substring(0, fileName.length() - ".js".length());
        String source = Files.readString(sourceFile, StandardCharsets.UTF_8);

        Path manifestFile = sourceFile.resolveSibling(name + ".json");
        if (!Files.exists(manifestFile)) {
            return new SandboxModule(name, "Sandboxed module " + name, source, List.of(), null);
        }

        JsonNode manifest = objectMapper.readTree(manifestFile.toFile());
        List<Capability> required = manifest.has("requiredCapabilities")
                ? objectMapper.convertValue(manifest.get("requiredCapabilities"), new TypeReference<>() {})
                : List.of();
        Map<String, Object> schema = manifest.has("inputSchema")
                ? objectMapper.convertValue(manifest.get("inputSchema"), new TypeReference<>() {})
                : null;
        return new SandboxModule(name,
                manifest.path("description").asText("Sandboxed module " + name),
                source, required, schema);
    }

    private void loadQuietly(Path file) {
        try {
            register(load(file));
        } catch (IOException | IllegalArgumentException e) {
            log.error("Skipping sandbox module {}: {}", file.getFileName(), e.getMessage());
        }
    }
}
