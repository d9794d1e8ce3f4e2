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
import java.util.Optional;

/**
 * Cumulative character count of one author's messages.
 */
@Component
public class CharsRule extends AbstractAntiSpamRule {

    public static final String NAME = "chars";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> apply(ChatMessage trigger, List<ChatMessage> window, RuleConfig config) {
        return sumOverAuthor(trigger, window, config, "characters", message -> contentOf(message).length());
    }
}
