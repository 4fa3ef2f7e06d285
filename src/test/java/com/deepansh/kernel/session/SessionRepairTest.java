package com.deepansh.kernel.session;

import com.deepansh.kernel.model.ContentBlock;
import com.deepansh.kernel.model.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class SessionRepairTest {

    @Test
    void orphanedToolResult_isDroppedWithItsEmptyMessage() {
        List<Message> messages = List.of(
                Message.user("hi"),
                Message.assistant("hello"),
                Message.of(Message.Role.user, ContentBlock.toolResult("missing", "stale", false)),
                Message.user("next"));

        List<Message> repaired = SessionRepair.repair(messages);

        assertThat(repaired).hasSize(3);
        assertThat(repaired).allSatisfy(m -> assertThat(m.getContent())
                .noneMatch(b -> b.getType() == ContentBlock.Type.tool_result));
    }

    @Test
    void matchedToolResult_isKept() {
        List<Message> messages = List.of(
                Message.user("read it"),
                Message.of(Message.Role.assistant, ContentBlock.toolUse("t1", "file_read", Map.of("path", "/a"))),
                Message.of(Message.Role.user, ContentBlock.toolResult("t1", "contents", false)));

        assertThat(SessionRepair.repair(messages)).hasSize(3);
    }

    @Test
    void consecutiveSameRole_isMergedInOrder() {
        List<Message> messages = List.of(
                Message.user("one"),
                Message.user("two"),
                Message.assistant("three"));

        List<Message> repaired = SessionRepair.repair(messages);

        assertThat(repaired).hasSize(2);
        assertThat(repaired.get(0).getContent()).extracting(ContentBlock::getText).containsExactly("one", "two");
    }

    @Test
    void repair_isIdempotent() {
        List<Message> messages = List.of(
                Message.user("a"),
                Message.user("b"),
                Message.of(Message.Role.user, ContentBlock.toolResult("ghost", "x", true)),
                Message.assistant("c"),
                Message.assistant("d"));

        List<Message> once = SessionRepair.repair(messages);
        List<Message> twice = SessionRepair.repair(once);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void repair_doesNotModifyInput() {
        List<Message> messages = new ArrayList<>(List.of(Message.user("a"), Message.user("b")));

        SessionRepair.repair(messages);

        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).getContent()).hasSize(1);
    }

    @Test
    void repair_emptyOrNull_returnsEmptyList() {
        assertThat(SessionRepair.repair(null)).isEmpty();
        assertThat(SessionRepair.repair(List.of(Message.of(Message.Role.user, List.of())))).isEmpty();
    }

    @Test
    void repair_isIdempotentOnRandomConversations() {
        Random random = new Random(42);
        for (int round = 0; round < 500; round++) {
            List<Message> messages = randomConversation(random);

            List<Message> once = SessionRepair.repair(messages);

            assertThat(SessionRepair.repair(once)).as("round %d: %s", round, messages).isEqualTo(once);
        }
    }

    private static List<Message> randomConversation(Random random) {
        List<String> issuedIds = new ArrayList<>();
        List<Message> messages = new ArrayList<>();
        int length = random.nextInt(12);
        for (int i = 0; i < length; i++) {
            Message.Role role = random.nextBoolean() ? Message.Role.user : Message.Role.assistant;
            List<ContentBlock> blocks = new ArrayList<>();
            int blockCount = random.nextInt(4);
            for (int b = 0; b < blockCount; b++) {
                switch (random.nextInt(4)) {
                    case 0 -> blocks.add(ContentBlock.text("t" + random.nextInt(100)));
                    case 1 -> {
                        String id = "call-" + i + "-" + b;
                        issuedIds.add(id);
                        blocks.add(ContentBlock.toolUse(id, "file_read", Map.of("path", "/" + b)));
                    }
                    case 2 -> {
                        String target = !issuedIds.isEmpty() && random.nextBoolean()
                                ? issuedIds.get(random.nextInt(issuedIds.size()))
                                : "orphan-" + random.nextInt(5);
                        blocks.add(ContentBlock.toolResult(target, "out", random.nextBoolean()));
                    }
                    default -> blocks.add(ContentBlock.toolResult("orphan-" + random.nextInt(5), "stale", false));
                }
            }
            messages.add(Message.of(role, blocks));
        }
        return messages;
    }
}
