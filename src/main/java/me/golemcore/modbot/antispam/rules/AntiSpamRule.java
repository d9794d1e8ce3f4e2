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

import java.util.List;
import java.util.Optional;

/**
 * A threshold predicate over a sliding window of recent channel messages.
 * Implementations are stateless Spring beans and must not depend on the order
 * in which other rules run.
 */
public interface AntiSpamRule {

    /**
     * Returns the configuration key of this rule (e.g. "burst", "role_mentions").
     *
     * @return the rule name
     */
    String getName();

    /**
     * Evaluates the rule for a newly received message.
     *
     * @param trigger
     *            the message that was just received
     * @param window
     *            recent messages of the trigger's channel, newest first
     * @param config
     *            thresholds bound to this rule at startup
     * @return a violation when the measured count strictly exceeds
     *         {@code config.max()}, empty otherwise
     */
    Optional<RuleViolation> apply(ChatMessage trigger, List<ChatMessage> window, RuleConfig config);

    /**
     * Names of the rule-specific extras that must be configured.
     */
    default List<String> getRequiredExtras() {
        return List.of();
    }
}
