package com.deepansh.kernel.session;

import com.deepansh.kernel.model.ContentBlock;
import com.deepansh.kernel.model.Message;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Restores the structural invariants of a conversation before it reaches the driver:
 * <ol>
 *   <li>collect every tool_use id present,</li>
 *   <li>drop tool_result blocks whose tool_use_id is unknown, then drop messages left empty,</li>
 *   <li>merge consecutive same-role messages, concatenating blocks in order.</li>
 * </ol>
 * Pure and idempotent; the input list and its messages are never modified.
 */
public final class SessionRepair {

    private SessionRepair() {
    }

    public static List<Message> repair(List<Message> messages) {
        if (messages == null || messages.isEmpty()) return new ArrayList<>();

        Set<String> toolUseIds = new HashSet<>();
        for (Message message : messages) {
            for (ContentBlock block : blocks(message)) {
                if (block.getType() == ContentBlock.Type.tool_use && block.getId() != null) {
                    toolUseIds.add(block.getId());
                }
            }
        }

        List<Message> filtered = new ArrayList<>();
        for (Message message : messages) {
            if (message == null || message.getRole() == null) continue;
            List<ContentBlock> kept = new ArrayList<>();
            for (ContentBlock block : blocks(message)) {
                if (block == null) continue;
                if (block.getType() == ContentBlock.Type.tool_result
                        && !toolUseIds.contains(block.getToolUseId())) {
                    continue;
                }
                kept.add(block);
            }
            if (!kept.isEmpty()) {
                filtered.add(Message.of(message.getRole(), kept));
            }
        }

        List<Message> merged = new ArrayList<>();
        for (Message message : filtered) {
            Message last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && last.getRole() == message.getRole()) {
                last.getContent().addAll(message.getContent());
            } else {
                merged.add(message);
            }
        }
        return merged;
    }

    private static List<ContentBlock> blocks(Message message) {
        if (message == null || message.getContent() == null) return List.of();
        return message.getContent();
    }
}
