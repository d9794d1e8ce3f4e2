package me.golemcore.modbot.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static me.golemcore.modbot.testsupport.TestMessages.CHANNEL;
import static me.golemcore.modbot.testsupport.TestMessages.message;
import static org.junit.jupiter.api.Assertions.*;

class DetectionContextTest {

    @Test
    void shouldStartEmpty() {
        assertTrue(new DetectionContext(CHANNEL).isEmpty());
    }

    @Test
    void shouldDeduplicateMessagesAndMembersAcrossRules() {
        ChatMessage first = message("u1", 1, "spam");
        ChatMessage second = message("u1", 2, "spam");
        DetectionContext context = new DetectionContext(CHANNEL);

        context.add(RuleViolation.of("burst", "sent 2 messages", List.of(second, first)));
        context.add(RuleViolation.of("duplicates", "sent 2 duplicated messages", List.of(second, first)));

        assertFalse(context.isEmpty());
        assertEquals(Set.of("burst", "duplicates"), context.getRuleNames());
        assertEquals(2, context.getMessageList().size());
        assertEquals(1, context.getMembers().size());
        assertEquals("name-u1", context.getMembers().get("u1"));
        assertEquals(List.of("burst: sent 2 messages", "duplicates: sent 2 duplicated messages"),
                context.getReasons());
    }

    @Test
    void shouldFallBackToIdWhenNameMissing() {
        ChatMessage anonymous = message("u9", 0, "x").toBuilder().authorName(null).build();
        DetectionContext context = new DetectionContext(CHANNEL);

        context.add(RuleViolation.of("burst", "r", List.of(anonymous)));

        assertEquals("u9", context.getMembers().get("u9"));
    }

    @Test
    void shouldMergeContexts() {
        DetectionContext left = new DetectionContext(CHANNEL);
        left.add(RuleViolation.of("burst", "r1", List.of(message("u1", 0, "a"))));
        DetectionContext right = new DetectionContext(CHANNEL);
        ChatMessage other = message("u2", 1, "b");
        right.add(RuleViolation.of("links", "r2", List.of(other)));

        left.merge(right);

        assertTrue(left.hasMember("u2"));
        assertTrue(left.hasMessage(other.getId()));
        assertEquals(Set.of("burst", "links"), left.getRuleNames());
    }
}
