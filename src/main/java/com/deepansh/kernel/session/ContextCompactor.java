package com.deepansh.kernel.session;

import com.deepansh.kernel.config.KernelProperties;
import com.deepansh.kernel.model.ContentBlock;
import com.deepansh.kernel.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps a session inside the model's context budget.
 *
 * Above the high-water mark the oldest messages are replaced with a summary of what was
 * dropped; above the urgent mark only the last few messages survive. Every trim is followed
 * by {@link SessionRepair} since cutting can orphan tool results or break role alternation.
 */
@Component
@Slf4j
public class ContextCompactor {

    private static final int PREVIEW_CHARS = 160;

    private final KernelProperties.Compaction config;

    public ContextCompactor(KernelProperties properties) {
        this.config = properties.getCompaction();
    }

    public CompactionResult compact(List<Message> messages) {
        long before = TokenEstimator.estimate(messages, config.getCharsPerToken());

        if (before > config.urgentTokens()) {
            return trim(messages, config.getEmergencyKeep(), CompactionResult.Level.TRUNCATED, before);
        }
        if (before > config.highWaterTokens()) {
            return trim(messages, config.getKeepRecent(), CompactionResult.Level.SUMMARIZED, before);
        }
        return new CompactionResult(messages, CompactionResult.Level.NONE, 0, before, before);
    }

    private CompactionResult trim(List<Message> messages, int keep, CompactionResult.Level level, long before) {
        if (messages.size() <= keep) {
            return new CompactionResult(messages, CompactionResult.Level.NONE, 0, before, before);
        }

        int cut = messages.size() - keep;
        List<Message> dropped = messages.subList(0, cut);
        String summary = level == CompactionResult.Level.SUMMARIZED
                ? summarize(dropped)
                : truncationNote(dropped);

        List<Message> compacted = new ArrayList<>();
        compacted.add(Message.user(summary));
        compacted.addAll(messages.subList(cut, messages.size()));
        compacted = SessionRepair.repair(compacted);

        long after = TokenEstimator.estimate(compacted, config.getCharsPerToken());
        log.info("Context compacted [level={}, dropped={}, tokens {} -> {}]", level, cut, before, after);
        return new CompactionResult(compacted, level, cut, before, after);
    }

    private String summarize(List<Message> dropped) {
        StringBuilder sb = new StringBuilder();
        sb.append("[Summary of ").append(dropped.size()).append(" earlier messages]\n");
        for (Message message : dropped) {
            for (ContentBlock block : message.getContent()) {
                String line = describe(message.getRole(), block);
                if (line == null) continue;
                if (sb.length() + line.length() > config.getSummaryMaxChars()) {
                    sb.append("...\n");
                    return sb.toString().trim();
                }
                sb.append(line).append('\n');
            }
        }
        return sb.toString().trim();
    }

    private String truncationNote(List<Message> dropped) {
        Set<String> tools = new LinkedHashSet<>();
        for (Message message : dropped) {
            message.toolUses().forEach(b -> tools.add(b.getName()));
        }
        return "[Context truncated: " + dropped.size() + " earlier messages removed"
                + (tools.isEmpty() ? "" : "; tools used: " + String.join(", ", tools)) + "]";
    }

    private String describe(Message.Role role, ContentBlock block) {
        return switch (block.getType()) {
            case text -> role + ": " + preview(block.getText());
            case tool_use -> role + " called " + block.getName();
            case tool_result -> "tool result" + (block.isError() ? " (error)" : "") + ": " + preview(block.getContent());
            case image -> null;
        };
    }

    private String preview(String s) {
        if (s == null) return "";
        String flat = s.replace('\n', ' ').trim();
        return flat.length() <= PREVIEW_CHARS ? flat : flat.substring(0, PREVIEW_CHARS) + "...";
    }
}
