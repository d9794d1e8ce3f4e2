package me.golemcore.modbot.antispam.rules;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.RuleConfig;
import me.golemcore.modbot.domain.model.RuleViolation;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cumulative user mentions by one author. Mentions of bots, of the author
 * themselves and of the author of the message being replied to are not
 * counted.
 */
@Component
public class MentionsRule extends AbstractAntiSpamRule {

    public static final String NAME = "mentions";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> apply(ChatMessage trigger, List<ChatMessage> window, RuleConfig config) {
        return sumOverAuthor(trigger, window, config, "mentions", MentionsRule::countMentions);
    }

    private static int countMentions(ChatMessage message) {
        if (message.getMentions() == null) {
            return 0;
        }
        int count = 0;
        for (ChatMessage.Mention mention : message.getMentions()) {
            if (mention.isBot()
                    || Objects.equals(mention.getUserId(), message.getAuthorId())
                    || Objects.equals(mention.getUserId(), message.getReplyToAuthorId())) {
                continue;
            }
            count++;
        }
        return count;
    }
}
