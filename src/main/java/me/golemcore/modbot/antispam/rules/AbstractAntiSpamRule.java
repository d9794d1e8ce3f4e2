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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Base class for rules that sum a per-message metric over the window.
 *
 * <p>
 * A message belongs to the window when
 * {@code 0 <= trigger.timestamp - message.timestamp < interval}: the boundary
 * is exclusive, so a message exactly {@code interval} old no longer counts.
 * The trigger is always considered, even if the caller's window omits it.
 */
public abstract class AbstractAntiSpamRule implements AntiSpamRule {

    /**
     * Messages inside the rule's interval, newest first.
     *
     * @param authorOnly
     *            keep only the trigger author's messages
     */
    protected List<ChatMessage> relevantMessages(ChatMessage trigger, List<ChatMessage> window,
            RuleConfig config, boolean authorOnly) {
        List<ChatMessage> relevant = new ArrayList<>();
        boolean triggerSeen = false;
        for (ChatMessage message : window) {
            if (Objects.equals(message.getId(), trigger.getId())) {
                triggerSeen = true;
                relevant.add(trigger);
                continue;
            }
            if (!isWithinInterval(trigger, message, config.interval())) {
                continue;
            }
            if (authorOnly && !Objects.equals(message.getAuthorId(), trigger.getAuthorId())) {
                continue;
            }
            relevant.add(message);
        }
        if (!triggerSeen) {
            relevant.add(0, trigger);
        }
        return relevant;
    }

    /**
     * Sums {@code metric} over the trigger author's recent messages and fires when
     * the total exceeds {@code max}. Only messages with a non-zero metric are
     * reported.
     */
    protected Optional<RuleViolation> sumOverAuthor(ChatMessage trigger, List<ChatMessage> window,
            RuleConfig config, String noun, ToIntFunction<ChatMessage> metric) {
        List<ChatMessage> contributors = new ArrayList<>();
        int total = 0;
        for (ChatMessage message : relevantMessages(trigger, window, config, true)) {
            int count = metric.applyAsInt(message);
            if (count > 0) {
                total += count;
                contributors.add(message);
            }
        }
        if (total <= config.max()) {
            return Optional.empty();
        }
        return Optional.of(RuleViolation.of(getName(), reason(total, noun, config), contributors));
    }

    protected static String reason(int count, String noun, RuleConfig config) {
        return "sent " + count + " " + noun + " in " + config.interval().toSeconds() + "s (max "
                + config.max() + ")";
    }

    protected static String contentOf(ChatMessage message) {
        return message.getContent() != null ? message.getContent() : "";
    }

    protected static int sizeOf(List<?> list) {
        return list != null ? list.size() : 0;
    }

    private static boolean isWithinInterval(ChatMessage trigger, ChatMessage message, Duration interval) {
        if (message.getTimestamp() == null || trigger.getTimestamp() == null) {
            return false;
        }
        Duration age = Duration.between(message.getTimestamp(), trigger.getTimestamp());
        return !age.isNegative() && age.compareTo(interval) < 0;
    }
}
