package com.deepansh.kernel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One turn of conversation: a role plus an ordered list of content blocks.
 *
 * Tool results travel in user-role messages, directly after the assistant
 * message holding the matching tool_use blocks. Roles must alternate; the
 * session repair pass restores that before every driver call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        user, assistant
    }

    private Role role;

    @Builder.Default
    private List<ContentBlock> content = new ArrayList<>();

    public static Message user(String text) {
        return of(Role.user, ContentBlock.text(text));
    }

    public static Message assistant(String text) {
        return of(Role.assistant, ContentBlock.text(text));
    }

    public static Message of(Role role, ContentBlock... blocks) {
        return Message.builder().role(role).content(new ArrayList<>(List.of(blocks))).build();
    }

    public static Message of(Role role, List<ContentBlock> blocks) {
        return Message.builder().role(role).content(new ArrayList<>(blocks)).build();
    }

    /** Concatenated text of all text blocks, newline separated. */
    @JsonIgnore
    public String textContent() {
        if (content == null) return "";
        return content.stream()
                .filter(b -> b.getType() == ContentBlock.Type.text && b.getText() != null)
                .map(ContentBlock::getText)
                .collect(Collectors.joining("\n"));
    }

    @JsonIgnore
    public List<ContentBlock> toolUses() {
        if (content == null) return List.of();
        return content.stream().filter(b -> b.getType() == ContentBlock.Type.tool_use).toList();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return content == null || content.isEmpty();
    }

    /** Rough size in characters, used for token estimation. */
    @JsonIgnore
    public int charLength() {
        if (content == null) return 0;
        return content.stream().mapToInt(ContentBlock::charLength).sum();
    }
}
