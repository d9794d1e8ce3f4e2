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

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates the violations found in one channel so that an author tripping
 * several rules is punished and reported once, and every offending message is
 * deleted once.
 *
 * <p>
 * Merging is a union: members and messages already present are kept, rule
 * names and reasons are appended in arrival order. Not thread-safe; callers
 * hold the channel lock.
 *
 * @since 1.0
 */
@Getter
public class DetectionContext {

    private final String channelId;
    private final Map<String, String> members = new LinkedHashMap<>(); // userId -> display name
    private final Set<String> ruleNames = new LinkedHashSet<>();
    private final Map<String, ChatMessage> messages = new LinkedHashMap<>();
    private final List<String> reasons = new ArrayList<>();

    public DetectionContext(String channelId) {
        this.channelId = channelId;
    }

    public void add(RuleViolation violation) {
        ruleNames.add(violation.getRuleName());
        reasons.add(violation.getRuleName() + ": " + violation.getReason());
        for (ChatMessage message : violation.getMessages()) {
            messages.putIfAbsent(message.getId(), message);
            String name = message.getAuthorName() != null ? message.getAuthorName() : message.getAuthorId();
            members.putIfAbsent(message.getAuthorId(), name);
        }
        for (String memberId : violation.getMembers()) {
            members.putIfAbsent(memberId, memberId);
        }
    }

    /**
     * Folds another context for the same channel into this one.
     */
    public void merge(DetectionContext other) {
        ruleNames.addAll(other.ruleNames);
        reasons.addAll(other.reasons);
        other.messages.forEach(messages::putIfAbsent);
        other.members.forEach(members::putIfAbsent);
    }

    public boolean isEmpty() {
        return ruleNames.isEmpty();
    }

    public boolean hasMember(String userId) {
        return members.containsKey(userId);
    }

    public boolean hasMessage(String messageId) {
        return messages.containsKey(messageId);
    }

    public Collection<ChatMessage> getMessageList() {
        return Collections.unmodifiableCollection(messages.values());
    }
}
