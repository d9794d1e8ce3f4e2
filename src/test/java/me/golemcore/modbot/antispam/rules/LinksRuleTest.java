package me.golemcore.modbot.antispam.rules;

import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.RuleConfig;
import me.golemcore.modbot.domain.model.RuleViolation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static me.golemcore.modbot.testsupport.TestMessages.message;
import static org.junit.jupiter.api.Assertions.*;

class LinksRuleTest {

    private final LinksRule rule = new LinksRule();

    @Test
    void shouldCountHttpAndHttpsLinks() {
        assertEquals(2, LinksRule.countLinks("see http://a.example and https://b.example/x?y=1"));
        assertEquals(0, LinksRule.countLinks("ftp://nope and www.example.com"));
    }

    @Test
    void shouldFireOnSingleMessageOverMax() {
        ChatMessage trigger = message("u1", 0, "https://a.io https://b.io https://c.io");

        Optional<RuleViolation> violation = rule.apply(trigger, List.of(trigger), RuleConfig.of(10, 2));

        assertTrue(violation.isPresent());
        assertEquals("sent 3 links in 10s (max 2)", violation.get().getReason());
    }

    @Test
    void shouldReportOnlyMessagesWithLinks() {
        ChatMessage trigger = message("u1", 3, "https://a.io https://b.io");
        ChatMessage plain = message("u1", 2, "no links here");
        ChatMessage earlier = message("u1", 1, "https://c.io");

        Optional<RuleViolation> violation = rule.apply(trigger, List.of(trigger, plain, earlier),
                RuleConfig.of(10, 2));

        assertTrue(violation.isPresent());
        assertEquals(List.of(trigger, earlier), violation.get().getMessages());
    }
}
