package com.deepansh.kernel.tool;

import com.deepansh.kernel.config.KernelProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * File access confined to the workspace base directory. Shared by the file tools
 * and the sandbox fs_* host functions.
 *
 * Paths are given relative to the base directory. Capability checks use the
 * normalized form with a leading slash, e.g. {@code /notes/today.md}, so a grant of
 * {@code FileRead("/notes/*")} covers everything under notes/.
 */
@Component
@Slf4j
public class WorkspaceFiles {

    private final KernelProperties.Tools.Files config;

    public WorkspaceFiles(KernelProperties properties) {
        this.config = properties.getTools().getFiles();
    }

    /** Capability target for {@code path}; rejects traversal out of the workspace. */
    public String capabilityPath(String path) {
        Path base = baseDir();
        Path resolved = resolve(base, path);
        String relative = base.relativize(resolved).toString().replace('\\', '/');
        return "/" + relative;
    }

    public String read(String path) throws IOException {
        Path file = resolve(baseDir(), path);
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IOException("File not found: " + path);
        }
        long sizeKb = Files.size(file) / 1024;
        if (sizeKb > config.getMaxFileSizeKb()) {
            throw new IOException(String.format("File too large (%d KB). Max allowed: %d KB",
                    sizeKb, config.getMaxFileSizeKb()));
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        log.debug("Read file: {} ({} chars)", path, content.length());
        return content;
    }

    /** Returns the number of bytes written. */
    public int write(String path, String content, boolean append) throws IOException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > config.getMaxFileSizeKb() * 1024L) {
            throw new IOException(String.format("Content too large (%d bytes). Max: %d KB",
                    bytes.length, config.getMaxFileSizeKb()));
        }
        Path base = baseDir();
        Path file = resolve(base, path);
        if (file.equals(base)) {
            throw new IOException("Path must name a file");
        }
        Files.createDirectories(file.getParent());
        if (append) {
            Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } else {
            Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        }
        log.info("{} file: {} ({} bytes)", append ? "Appended" : "Wrote", path, bytes.length);
        return bytes.length;
    }

    /** Workspace-relative paths of regular files under {@code path}, two levels deep, sorted. */
    public List<String> list(String path) throws IOException {
        Path base = baseDir();
        Path dir = path == null || path.isBlank() ? base : resolve(base, path);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(dir, 2)) {
            return stream.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .map(p -> base.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        }
    }

    private Path resolve(Path base, String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("'path' is required");
        }
        String relative = path.startsWith("/") ? path.substring(1) : path;
        Path resolved = base.resolve(relative).normalize();
        if (!resolved.startsWith(base)) {
            throw new SecurityException("Path traversal attempt detected: '" + path + "'");
        }
        return resolved;
    }

    private Path baseDir() {
        Path base = Paths.get(config.getBaseDirectory()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(base);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create workspace directory " + base, e);
        }
        return base;
    }
}
