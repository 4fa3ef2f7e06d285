package com.deepansh.kernel.tool;

import com.deepansh.kernel.config.KernelProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a program directly from an argv list, never through a shell, so shell syntax
 * is passed through literally. Stdout and stderr are merged and capped.
 */
@Component
@Slf4j
public class ShellRunner {

    public record Result(int exitCode, String output, boolean timedOut) {
    }

    private final KernelProperties.Tools properties;

    public ShellRunner(KernelProperties properties) {
        this.properties = properties.getTools();
    }

    /** Capability target for a command, e.g. {@code git status}. */
    public static String commandLine(List<String> argv) {
        return String.join(" ", argv);
    }

    /** Splits a whitespace-separated command string into argv. No quoting rules. */
    public static List<String> argv(String command, List<?> extraArgs) {
        List<String> argv = new ArrayList<>();
        if (command != null) {
            for (String part : command.trim().split("\\s+")) {
                if (!part.isEmpty()) argv.add(part);
            }
        }
        if (extraArgs != null) {
            extraArgs.forEach(a -> argv.add(String.valueOf(a)));
        }
        return argv;
    }

    public Result run(List<String> argv) throws IOException, InterruptedException {
        if (argv.isEmpty()) {
            throw new IllegalArgumentException("'command' is required");
        }
        Path workDir = Paths.get(properties.getFiles().getBaseDirectory()).toAbsolutePath().normalize();
        workDir.toFile().mkdirs();

        Process process = new ProcessBuilder(argv)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .start();

        OutputCollector collector = new OutputCollector(process.getInputStream(),
                properties.getShell().getMaxOutputChars());
        Thread reader = new Thread(collector, "shell-output-reader");
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(properties.getShell().getTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                reader.join(1_000);
                log.warn("Command timed out after {}ms: {}", properties.getShell().getTimeoutMs(), commandLine(argv));
                return new Result(-1, collector.output(), true);
            }
            reader.join(1_000);
            int exit = process.exitValue();
            log.info("Command finished [exit={}]: {}", exit, commandLine(argv));
            return new Result(exit, collector.output(), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private static final class OutputCollector implements Runnable {

        private final InputStream in;
        private final int maxChars;
        private final StringBuilder buffer = new StringBuilder();
        private boolean truncated;

        OutputCollector(InputStream in, int maxChars) {
            this.in = in;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[4096];
            try (in) {
                int n;
                while ((n = in.read(chunk)) != -1) {
                    append(new String(chunk, 0, n, StandardCharsets.UTF_8));
                }
            } catch (IOException e) {
                log.debug("Process output stream closed: {}", e.getMessage());
            }
        }

        private synchronized void append(String s) {
            int room = maxChars - buffer.length();
            if (room <= 0) {
                truncated = true;
                return;
            }
            if (s.length() > room) {
                buffer.append(s, 0, room);
                truncated = true;
            } else {
                buffer.append(s);
            }
        }

        synchronized String output() {
            return truncated ? buffer + "\n...[output truncated]" : buffer.toString();
        }
    }
}
