package me.golemcore.modbot.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one rule firing: a readable reason plus exactly the authors and
 * messages that pushed the count over the threshold.
 *
 * @since 1.0
 */
@Data
@Builder
public class RuleViolation {

    private String ruleName;
    private String reason;
    private Set<String> members;
    private List<ChatMessage> messages;

    public static RuleViolation of(String ruleName, String reason, List<ChatMessage> messages) {
        Set<String> members = new LinkedHashSet<>();
        for (ChatMessage message : messages) {
            members.add(message.getAuthorId());
        }
        return RuleViolation.builder()
                .ruleName(ruleName)
                .reason(reason)
                .members(members)
                .messages(List.copyOf(messages))
                .build();
    }
}
