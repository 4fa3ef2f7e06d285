package com.deepansh.kernel.session;

import com.deepansh.kernel.model.Message;

import java.util.List;

public record CompactionResult(List<Message> messages, Level level, int droppedMessages,
                               long tokensBefore, long tokensAfter) {

    public enum Level {
        NONE,
        /** Oldest messages replaced by a summary */
        SUMMARIZED,
        /** Only the most recent few messages kept */
        TRUNCATED
    }

    public boolean compacted() {
        return level != Level.NONE;
    }
}
