package me.golemcore.modbot.antispam;

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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-channel history of recent messages, newest first. Once a channel
 * holds {@code capacity} messages the oldest is evicted.
 */
public class MessageCache {

    private final int capacity;
    private final Map<String, Deque<ChatMessage>> channels = new ConcurrentHashMap<>();

    public MessageCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void append(ChatMessage message) {
        Deque<ChatMessage> deque = channels.computeIfAbsent(message.getChannelId(), id -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addFirst(message);
            while (deque.size() > capacity) {
                deque.removeLast();
            }
        }
    }

    /**
     * Replace the cached copy of an edited message.
     *
     * @return false when the message is no longer cached
     */
    public boolean update(ChatMessage edited) {
        Deque<ChatMessage> deque = channels.get(edited.getChannelId());
        if (deque == null) {
            return false;
        }
        synchronized (deque) {
            List<ChatMessage> snapshot = new ArrayList<>(deque);
            for (int i = 0; i < snapshot.size(); i++) {
                if (Objects.equals(snapshot.get(i).getId(), edited.getId())) {
                    snapshot.set(i, edited);
                    deque.clear();
                    deque.addAll(snapshot);
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Messages of the channel no older than {@code lookback} relative to
     * {@code now}, newest first.
     */
    public List<ChatMessage> window(String channelId, Instant now, Duration lookback) {
        Deque<ChatMessage> deque = channels.get(channelId);
        if (deque == null) {
            return List.of();
        }
        Instant earliest = now.minus(lookback);
        List<ChatMessage> window = new ArrayList<>();
        synchronized (deque) {
            Iterator<ChatMessage> iterator = deque.iterator();
            while (iterator.hasNext()) {
                ChatMessage message = iterator.next();
                if (message.getTimestamp() != null && message.getTimestamp().isBefore(earliest)) {
                    break;
                }
                window.add(message);
            }
        }
        return window;
    }

    public int size(String channelId) {
        Deque<ChatMessage> deque = channels.get(channelId);
        if (deque == null) {
            return 0;
        }
        synchronized (deque) {
            return deque.size();
        }
    }
}
