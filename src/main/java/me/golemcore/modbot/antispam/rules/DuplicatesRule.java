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
 * Repeats of the trigger's exact content by its author. Empty messages (e.g.
 * attachment-only) never count as duplicates.
 */
@Component
public class DuplicatesRule extends AbstractAntiSpamRule {

    public static final String NAME = "duplicates";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> apply(ChatMessage trigger, List<ChatMessage> window, RuleConfig config) {
        String content = contentOf(trigger);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        return sumOverAuthor(trigger, window, config, "duplicated messages",
                message -> content.equals(contentOf(message)) ? 1 : 0);
    }
}
