package me.golemcore.modbot.antispam.rules;

import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.RuleConfig;
import me.golemcore.modbot.domain.model.RuleViolation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static me.golemcore.modbot.testsupport.TestMessages.message;
import static org.junit.jupiter.api.Assertions.*;

class EveryonePingRuleTest {

    private final EveryonePingRule rule = new EveryonePingRule();

    @Test
    void shouldFireOnFirstPingWhenMaxIsZero() {
        ChatMessage trigger = message("u1", 0, "hey @everyone look");

        Optional<RuleViolation> violation = rule.apply(trigger, List.of(trigger), RuleConfig.of(10, 0));

        assertTrue(violation.isPresent());
        assertEquals("sent 1 everyone pings in 10s (max 0)", violation.get().getReason());
    }

    @Test
    void shouldIgnoreMessagesWithoutPing() {
        ChatMessage trigger = message("u1", 0, "hello everyone");

        assertTrue(rule.apply(trigger, List.of(trigger), RuleConfig.of(10, 0)).isEmpty());
    }

    @Test
    void shouldNotCountHerePings() {
        ChatMessage trigger = message("u1", 0, "@here quick question");

        assertTrue(rule.apply(trigger, List.of(trigger), RuleConfig.of(10, 0)).isEmpty());
    }
}
