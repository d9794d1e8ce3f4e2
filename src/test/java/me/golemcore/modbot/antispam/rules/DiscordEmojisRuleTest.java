package me.golemcore.modbot.antispam.rules;

import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.RuleConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.modbot.testsupport.TestMessages.message;
import static org.junit.jupiter.api.Assertions.*;

class DiscordEmojisRuleTest {

    private final DiscordEmojisRule rule = new DiscordEmojisRule();

    @Test
    void shouldCountStaticAndAnimatedEmojis() {
        ChatMessage trigger = message("u1", 0, "<:pog:123> <a:dance:456> <:pog:123>");

        assertTrue(rule.apply(trigger, List.of(trigger), RuleConfig.of(10, 2)).isPresent());
    }

    @Test
    void shouldIgnoreEmojisInsideCodeBlocks() {
        ChatMessage trigger = message("u1", 0, "```\n<:pog:123> <:pog:123> <:pog:123>\n``` <:ok:1>");

        assertTrue(rule.apply(trigger, List.of(trigger), RuleConfig.of(10, 2)).isEmpty());
    }
}
