package me.golemcore.modbot.antispam.rules;

import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.RuleConfig;
import me.golemcore.modbot.domain.model.RuleViolation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static me.golemcore.modbot.testsupport.TestMessages.message;
import static org.junit.jupiter.api.Assertions.*;

class DuplicatesRuleTest {

    private static final RuleConfig CONFIG = RuleConfig.of(10, 3);

    private final DuplicatesRule rule = new DuplicatesRule();

    @Test
    void shouldFireOnFourthDuplicate() {
        ChatMessage trigger = message("u1", 4, "buy now");
        List<ChatMessage> window = List.of(
                trigger,
                message("u1", 3, "buy now"),
                message("u1", 2, "buy now"),
                message("u1", 1, "buy now"));

        Optional<RuleViolation> violation = rule.apply(trigger, window, CONFIG);

        assertTrue(violation.isPresent());
        assertEquals("sent 4 duplicated messages in 10s (max 3)", violation.get().getReason());
        assertEquals(4, violation.get().getMessages().size());
    }

    @Test
    void shouldNotExtendViolationWithDifferentMessage() {
        List<ChatMessage> duplicates = List.of(
                message("u1", 4, "buy now"),
                message("u1", 3, "buy now"),
                message("u1", 2, "buy now"),
                message("u1", 1, "buy now"));
        ChatMessage different = message("u1", 5, "something else");
        List<ChatMessage> window = new java.util.ArrayList<>();
        window.add(different);
        window.addAll(duplicates);

        assertTrue(rule.apply(different, window, CONFIG).isEmpty());
    }

    @Test
    void shouldOnlyReportMatchingMessages() {
        ChatMessage trigger = message("u1", 6, "spam");
        List<ChatMessage> window = List.of(
                trigger,
                message("u1", 5, "spam"),
                message("u1", 4, "unrelated"),
                message("u1", 3, "spam"),
                message("u1", 2, "spam"));

        Optional<RuleViolation> violation = rule.apply(trigger, window, CONFIG);

        assertTrue(violation.isPresent());
        assertTrue(violation.get().getMessages().stream().allMatch(m -> "spam".equals(m.getContent())));
    }

    @Test
    void shouldIgnoreEmptyContent() {
        ChatMessage trigger = message("u1", 4, "");
        List<ChatMessage> window = List.of(
                trigger,
                message("u1", 3, ""),
                message("u1", 2, ""),
                message("u1", 1, ""),
                message("u1", 0, ""));

        assertTrue(rule.apply(trigger, window, CONFIG).isEmpty());
    }
}
