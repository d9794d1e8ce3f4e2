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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Newline flooding by one author.
 *
 * <p>
 * Two thresholds apply in order: the total number of newlines across the
 * window ({@code max}), then the longest run of consecutive newlines inside a
 * single message ({@code max_consecutive}).
 */
@Component
public class NewlinesRule extends AbstractAntiSpamRule {

    public static final String NAME = "newlines";
    public static final String MAX_CONSECUTIVE = "max_consecutive";

    private static final Pattern NEWLINE_RUN = Pattern.compile("\n+");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<String> getRequiredExtras() {
        return List.of(MAX_CONSECUTIVE);
    }

    @Override
    public Optional<RuleViolation> apply(ChatMessage trigger, List<ChatMessage> window, RuleConfig config) {
        Optional<RuleViolation> total = sumOverAuthor(trigger, window, config, "newlines",
                message -> countNewlines(contentOf(message)));
        if (total.isPresent()) {
            return total;
        }

        int maxConsecutive = config.extra(MAX_CONSECUTIVE, Integer.MAX_VALUE);
        int longestRun = 0;
        List<ChatMessage> offenders = new ArrayList<>();
        for (ChatMessage message : relevantMessages(trigger, window, config, true)) {
            int run = longestRun(contentOf(message));
            if (run > maxConsecutive) {
                offenders.add(message);
                longestRun = Math.max(longestRun, run);
            }
        }
        if (offenders.isEmpty()) {
            return Optional.empty();
        }
        String reason = "sent " + longestRun + " consecutive newlines in " + config.interval().toSeconds()
                + "s (max " + maxConsecutive + ")";
        return Optional.of(RuleViolation.of(NAME, reason, offenders));
    }

    private static int countNewlines(String content) {
        int count = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static int longestRun(String content) {
        int longest = 0;
        Matcher matcher = NEWLINE_RUN.matcher(content);
        while (matcher.find()) {
            longest = Math.max(longest, matcher.end() - matcher.start());
        }
        return longest;
    }
}
