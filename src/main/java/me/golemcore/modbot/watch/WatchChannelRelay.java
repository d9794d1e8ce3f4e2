package me.golemcore.modbot.watch;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.Infraction;
import me.golemcore.modbot.domain.model.InfractionAppliedEvent;
import me.golemcore.modbot.domain.model.InfractionDeactivatedEvent;
import me.golemcore.modbot.domain.model.InfractionType;
import me.golemcore.modbot.infrastructure.config.BotProperties;
import me.golemcore.modbot.port.outbound.GatewayException;
import me.golemcore.modbot.port.outbound.GatewayPort;
import me.golemcore.modbot.port.outbound.InfractionApiException;
import me.golemcore.modbot.port.outbound.InfractionApiPort;
import me.golemcore.modbot.scheduling.DelayedTaskScheduler;
import me.golemcore.modbot.util.DurationParser;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Relays messages of watched users to a staff-only channel.
 *
 * <p>
 * Messages are queued per user and source channel. A consumer armed
 * {@code bot.watch.log-delay} after the first queued message drains the queue
 * and immediately re-arms itself while more messages keep arriving. A header
 * naming the user, the source channel and the watch reason is posted whenever
 * the author or channel changes, or after {@code header-message-limit}
 * messages in one run.
 *
 * <p>
 * A failed post is logged and skipped; the remaining messages are still
 * relayed.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class WatchChannelRelay {

    static final String CONSUME_TASK_ID = "watch-relay:consume";
    static final String CENSORED = "Content is censored because it contains a bot or webhook token.";

    private static final int FOOTER_WIDTH = 128;
    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern WEBHOOK_URL = Pattern.compile(
            "(discord(?:app)?\\.com/api/webhooks/\\d+/)\\S+/?", Pattern.CASE_INSENSITIVE);
    private static final Pattern BOT_TOKEN = Pattern.compile("[\\w-]{24,26}\\.[\\w-]{6}\\.[\\w-]{27,}");

    private final InfractionApiPort infractionApi;
    private final GatewayPort gateway;
    private final DelayedTaskScheduler scheduler;
    private final BotProperties properties;
    private final Clock clock;

    private final Map<String, Infraction> watchedUsers = new ConcurrentHashMap<>();
    private final Object queueLock = new Object();
    private final Map<String, Map<String, Deque<ChatMessage>>> messageQueue = new LinkedHashMap<>();
    private boolean consuming;
    private MessageHistory history = new MessageHistory(null, null);

    public WatchChannelRelay(InfractionApiPort infractionApi, GatewayPort gateway, DelayedTaskScheduler scheduler,
            BotProperties properties, Clock clock) {
        this.infractionApi = infractionApi;
        this.gateway = gateway;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== WATCHED USERS ====================

    /**
     * Reload watched users from the active {@code watch} infractions.
     *
     * @return false when the API could not be reached; the previous cache is kept
     */
    public boolean loadWatchedUsers() {
        List<Infraction> watches;
        try {
            watches = infractionApi.listInfractions(true, InfractionType.WATCH, null);
        } catch (InfractionApiException e) {
            log.error("[WatchRelay] Failed to fetch watched users: {}", e.getMessage());
            return false;
        }
        watchedUsers.clear();
        for (Infraction watch : watches) {
            watchedUsers.put(watch.getUserId(), watch);
        }
        log.info("[WatchRelay] Watching {} users", watchedUsers.size());
        return true;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getWatch().isEnabled()) {
            loadWatchedUsers();
        }
    }

    @EventListener
    public void onInfractionApplied(InfractionAppliedEvent event) {
        Infraction infraction = event.infraction();
        if (infraction.getType() == InfractionType.WATCH && infraction.isActive()) {
            watchedUsers.put(infraction.getUserId(), infraction);
            log.info("[WatchRelay] Started watching user {}", infraction.getUserId());
        }
    }

    @EventListener
    public void onInfractionDeactivated(InfractionDeactivatedEvent event) {
        Infraction infraction = event.infraction();
        if (infraction.getType() != InfractionType.WATCH) {
            return;
        }
        watchedUsers.remove(infraction.getUserId());
        synchronized (queueLock) {
            messageQueue.remove(infraction.getUserId());
        }
        log.info("[WatchRelay] Stopped watching user {}", infraction.getUserId());
    }

    public boolean isWatched(String userId) {
        return watchedUsers.containsKey(userId);
    }

    // ==================== QUEUE ====================

    /**
     * Queue a message if its author is watched.
     */
    public void onMessage(ChatMessage message) {
        if (!properties.getWatch().isEnabled() || !watchedUsers.containsKey(message.getAuthorId())) {
            return;
        }
        synchronized (queueLock) {
            messageQueue
                    .computeIfAbsent(message.getAuthorId(), id -> new LinkedHashMap<>())
                    .computeIfAbsent(message.getChannelId(), id -> new ArrayDeque<>())
                    .addLast(message);
            if (!consuming) {
                consuming = true;
                scheduler.schedule(CONSUME_TASK_ID, clock.instant().plus(properties.getWatch().getLogDelay()),
                        this::consumeMessages);
            }
        }
    }

    void consumeMessages() {
        Map<String, Map<String, Deque<ChatMessage>>> batch;
        synchronized (queueLock) {
            batch = new LinkedHashMap<>(messageQueue);
            messageQueue.clear();
        }
        try {
            for (Map<String, Deque<ChatMessage>> channelQueues : batch.values()) {
                for (Deque<ChatMessage> queue : channelQueues.values()) {
                    while (!queue.isEmpty()) {
                        ChatMessage message = queue.pollFirst();
                        try {
                            relay(message);
                        } catch (RuntimeException e) { // NOSONAR - remaining queued messages are still relayed
                            log.error("[WatchRelay] Failed to relay message {} from user {}", message.getId(),
                                    message.getAuthorId(), e);
                        }
                    }
                }
            }
        } finally {
            synchronized (queueLock) {
                if (messageQueue.isEmpty()) {
                    consuming = false;
                } else {
                    scheduler.schedule(CONSUME_TASK_ID, clock.instant(), this::consumeMessages);
                }
            }
        }
    }

    // ==================== RELAY ====================

    private void relay(ChatMessage message) {
        int limit = properties.getWatch().getHeaderMessageLimit();
        if (!Objects.equals(message.getAuthorId(), history.lastAuthor)
                || !Objects.equals(message.getChannelId(), history.lastChannel)
                || history.messageCount >= limit) {
            history = new MessageHistory(message.getAuthorId(), message.getChannelId());
            send(message, header(message));
        }

        String content = cleanContent(message);
        if (!content.isEmpty()) {
            send(message, content);
        }
        if (message.getAttachments() != null && !message.getAttachments().isEmpty()) {
            send(message, "Attachments: " + String.join(" ", message.getAttachments()));
        }
        history.messageCount++;
    }

    private void send(ChatMessage message, String content) {
        try {
            gateway.sendAs(properties.getWatch().getChannelId(), message.getAuthorName(), null, content);
        } catch (GatewayException e) {
            log.error("[WatchRelay] Failed to relay message {} from user {}: {}", message.getId(),
                    message.getAuthorId(), e.getMessage());
        }
    }

    String header(ChatMessage message) {
        Infraction watch = watchedUsers.get(message.getAuthorId());
        String footer;
        if (watch != null) {
            String added = watch.getInsertedAt() != null
                    ? timeSince(Duration.between(watch.getInsertedAt(), clock.instant()))
                    : "at an unknown time";
            footer = "Added " + added + " by " + watch.getActorId() + " | Reason: " + watch.getReason();
        } else {
            footer = "No longer watched";
        }
        return "<@" + message.getAuthorId() + "> in <#" + message.getChannelId() + ">\n" + shorten(footer);
    }

    /**
     * Message text as it should appear in the watch channel: censored when it
     * carries a token or webhook URL, with non-media links wrapped in code spans
     * so they do not embed.
     */
    static String cleanContent(ChatMessage message) {
        String content = message.getContent() != null ? message.getContent() : "";
        if (BOT_TOKEN.matcher(content).find() || WEBHOOK_URL.matcher(content).find()) {
            return CENSORED;
        }
        Set<String> mediaUrls = new HashSet<>(message.getEmbedUrls() != null ? message.getEmbedUrls() : List.of());
        StringBuilder sb = new StringBuilder();
        Matcher matcher = URL.matcher(content);
        while (matcher.find()) {
            String url = matcher.group();
            String replacement = mediaUrls.contains(url) ? url : "`" + url + "`";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String timeSince(Duration elapsed) {
        String formatted = DurationParser.format(elapsed);
        int space = formatted.indexOf(' ');
        return (space > 0 ? formatted.substring(0, space) : formatted) + " ago";
    }

    private static String shorten(String text) {
        String collapsed = text.replaceAll("\\s+", " ").trim();
        if (collapsed.length() <= FOOTER_WIDTH) {
            return collapsed;
        }
        return collapsed.substring(0, FOOTER_WIDTH - 3) + "...";
    }

    private static final class MessageHistory {
        private final String lastAuthor;
        private final String lastChannel;
        private int messageCount;

        private MessageHistory(String lastAuthor, String lastChannel) {
            this.lastAuthor = lastAuthor;
            this.lastChannel = lastChannel;
        }
    }
}
