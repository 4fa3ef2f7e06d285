package com.deepansh.kernel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly-typed configuration for the execution kernel.
 * Bound from application.yml under the "kernel" prefix.
 */
@Component
@ConfigurationProperties(prefix = "kernel")
@Data
public class KernelProperties {

    private Loop loop = new Loop();
    private Tools tools = new Tools();
    private LoopGuard loopGuard = new LoopGuard();
    private Quota quota = new Quota();
    private Compaction compaction = new Compaction();
    private Sandbox sandbox = new Sandbox();
    private Usage usage = new Usage();

    @Data
    public static class Loop {
        private int maxIterations = 50;
        /** Automatic "continue" re-prompts after a truncated or empty answer */
        private int maxContinuations = 3;
        private String defaultModel = "llama-3.3-70b-versatile";
        private int maxOutputTokens = 4096;
        private String systemPrompt = "You are a helpful agent. Use the tools you have been given when they help.";
    }

    @Data
    public static class Tools {
        private long timeoutMs = 120_000;
        private int maxResultChars = 50_000;
        /** Default per-agent bound on concurrently dispatched tool calls */
        private int maxConcurrent = 4;
        private int maxAgentDepth = 5;
        private Files files = new Files();
        private Shell shell = new Shell();
        private Web web = new Web();

        @Data
        public static class Files {
            private String baseDirectory = "./agent-workspace";
            private int maxFileSizeKb = 512;
        }

        @Data
        public static class Shell {
            private long timeoutMs = 30_000;
            private int maxOutputChars = 20_000;
        }

        @Data
        public static class Web {
            private int maxResponseChars = 20_000;
            /** Comma-separated; only these URL schemes can be fetched */
            private String allowedSchemes = "http,https";

            public List<String> getAllowedSchemeList() {
                if (allowedSchemes == null || allowedSchemes.isBlank()) return List.of();
                return Arrays.stream(allowedSchemes.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isBlank())
                        .toList();
            }
        }
    }

    @Data
    public static class LoopGuard {
        private int warnThreshold = 3;
        private int blockThreshold = 5;
        private int maxTotalCalls = 30;
    }

    @Data
    public static class Quota {
        private long defaultHourlyTokens = 1_000_000;
        private long windowSeconds = 3600;
    }

    @Data
    public static class Compaction {
        private int contextWindowTokens = 200_000;
        private double highWaterRatio = 0.7;
        private double urgentRatio = 0.9;
        private int keepRecent = 10;
        private int emergencyKeep = 4;
        private int charsPerToken = 4;
        private int summaryMaxChars = 2_000;

        public long highWaterTokens() {
            return (long) (contextWindowTokens * highWaterRatio);
        }

        public long urgentTokens() {
            return (long) (contextWindowTokens * urgentRatio);
        }
    }

    @Data
    public static class Sandbox {
        /** Guest statement budget; 0 disables instruction metering */
        private long fuelLimit = 1_000_000;
        private long timeoutMs = 30_000;
        private long maxMemoryBytes = 64L * 1024 * 1024;
        /** Directory scanned at startup for *.js tool modules; empty disables loading */
        private String modulesDir = "";
    }

    @Data
    public static class Usage {
        /** USD per million tokens, keyed by model id */
        private Map<String, ModelRate> rates = new HashMap<>();
        private ModelRate defaultRate = new ModelRate();

        @Data
        public static class ModelRate {
            private double inputPerMillion = 0.59;
            private double outputPerMillion = 0.79;
        }
    }
}
