package me.golemcore.modbot.domain.service;

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
import me.golemcore.modbot.antispam.MessageCache;
import me.golemcore.modbot.antispam.rules.RuleRegistry;
import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.DetectionContext;
import me.golemcore.modbot.domain.model.InfractionRequest;
import me.golemcore.modbot.domain.model.InfractionResult;
import me.golemcore.modbot.domain.model.InfractionType;
import me.golemcore.modbot.domain.model.ModLogEntry;
import me.golemcore.modbot.infrastructure.config.BotProperties;
import me.golemcore.modbot.port.outbound.GatewayException;
import me.golemcore.modbot.port.outbound.GatewayPort;
import me.golemcore.modbot.port.outbound.InfractionApiException;
import me.golemcore.modbot.port.outbound.ModLogPort;
import me.golemcore.modbot.scheduling.DelayedTaskScheduler;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Anti-spam coordinator: runs every bound rule against a channel's recent
 * messages and turns the violations into one moderation action.
 *
 * <p>
 * For each incoming message:
 * <ol>
 * <li>Skip bots, whitelisted channels and whitelisted roles</li>
 * <li>Cache the message and take the window of the largest rule interval</li>
 * <li>Evaluate rules in configuration order; a throwing rule counts as no
 * violation</li>
 * <li>Merge violations into one {@link DetectionContext}</li>
 * <li>Delete offending messages, mute each distinct member once, and fold the
 * pass into the channel's pending alert</li>
 * </ol>
 *
 * <p>
 * The pending alert is flushed after {@code bot.antispam.alert-delay}, so a
 * spam wave produces one upload and one staff ping. Messages and members
 * already in the pending alert are not deleted or punished again.
 *
 * <p>
 * Work is serialized per channel; different channels proceed in parallel.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AntiSpamService {

    static final String ALERT_TASK_PREFIX = "antispam-alert:";
    private static final int MAX_INLINE_LENGTH = 4080;
    private static final int MAX_INLINE_NEWLINES = 15;

    private final RuleRegistry ruleRegistry;
    private final InfractionService infractionService;
    private final GatewayPort gateway;
    private final ModLogPort modLog;
    private final DelayedTaskScheduler scheduler;
    private final BotProperties properties;
    private final Clock clock;
    private final MessageCache cache;
    private final KeyedLocks channelLocks = new KeyedLocks();
    private final Map<String, DetectionContext> pendingAlerts = new ConcurrentHashMap<>();

    public AntiSpamService(RuleRegistry ruleRegistry, InfractionService infractionService, GatewayPort gateway,
            ModLogPort modLog, DelayedTaskScheduler scheduler, BotProperties properties, Clock clock) {
        this.ruleRegistry = ruleRegistry;
        this.infractionService = infractionService;
        this.gateway = gateway;
        this.modLog = modLog;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
        this.cache = new MessageCache(properties.getAntispam().getCacheSize());
    }

    /**
     * Whether messages are being checked. A configuration that failed validation
     * disables the whole subsystem.
     */
    public boolean isActive() {
        return properties.getAntispam().isEnabled() && ruleRegistry.isValid();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void reportInvalidConfiguration() {
        if (ruleRegistry.isValid()) {
            return;
        }
        String errors = ruleRegistry.getValidationErrors().stream()
                .map(error -> "- " + error)
                .collect(Collectors.joining("\n"));
        log.error("[AntiSpam] Disabled because of invalid configuration");
        modLog.send(ModLogEntry.builder()
                .target(ModLogEntry.Target.MOD_ALERTS)
                .title("Anti-spam disabled")
                .text("The anti-spam subsystem was disabled because its configuration is invalid:\n" + errors)
                .pingEveryone(true)
                .build());
    }

    // ==================== EVENTS ====================

    public void onMessage(ChatMessage message) {
        if (!isActive() || shouldIgnore(message)) {
            return;
        }
        channelLocks.withLock(message.getChannelId(), () -> process(message));
    }

    /**
     * Keep the cached copy of an edited message current so later windows see the
     * new content.
     */
    public void onMessageEdit(ChatMessage edited) {
        if (edited.getChannelId() == null || edited.getId() == null) {
            return;
        }
        if (cache.update(edited)) {
            log.debug("[AntiSpam] Updated cached message {}", edited.getId());
        }
    }

    private boolean shouldIgnore(ChatMessage message) {
        if (message.getChannelId() == null || message.getAuthorId() == null || message.getTimestamp() == null) {
            return true;
        }
        if (message.isAuthorBot() || Objects.equals(message.getAuthorId(), properties.getGateway().getBotUserId())) {
            return true;
        }
        BotProperties.AntiSpamProperties antispam = properties.getAntispam();
        if (antispam.getChannelWhitelist().contains(message.getChannelId())) {
            return true;
        }
        List<String> roles = message.getAuthorRoleIds() != null ? message.getAuthorRoleIds() : List.of();
        return roles.stream().anyMatch(antispam.getRoleWhitelist()::contains);
    }

    private void process(ChatMessage message) {
        cache.append(message);
        List<ChatMessage> window = cache.window(message.getChannelId(), message.getTimestamp(),
                ruleRegistry.getMaxInterval());
        DetectionContext detected = detect(message, window);
        if (!detected.isEmpty()) {
            handleDetection(detected);
        }
    }

    // ==================== DETECTION ====================

    /**
     * Evaluate every bound rule against the window and merge the results.
     */
    public DetectionContext detect(ChatMessage trigger, List<ChatMessage> window) {
        DetectionContext context = new DetectionContext(trigger.getChannelId());
        for (RuleRegistry.BoundRule bound : ruleRegistry.getBoundRules()) {
            try {
                bound.rule().apply(trigger, window, bound.config()).ifPresent(context::add);
            } catch (RuntimeException e) { // NOSONAR - one broken rule must not hide the others
                log.error("[AntiSpam] Rule '{}' failed on message {}", bound.rule().getName(), trigger.getId(), e);
            }
        }
        return context;
    }

    private void handleDetection(DetectionContext pass) {
        String channelId = pass.getChannelId();
        DetectionContext pending = pendingAlerts.get(channelId);

        List<ChatMessage> newMessages = new ArrayList<>();
        for (ChatMessage message : pass.getMessageList()) {
            if (pending == null || !pending.hasMessage(message.getId())) {
                newMessages.add(message);
            }
        }
        List<String> newMembers = new ArrayList<>();
        for (String memberId : pass.getMembers().keySet()) {
            if (pending == null || !pending.hasMember(memberId)) {
                newMembers.add(memberId);
            }
        }

        if (pending == null) {
            pendingAlerts.put(channelId, pass);
            scheduler.schedule(ALERT_TASK_PREFIX + channelId,
                    clock.instant().plus(properties.getAntispam().getAlertDelay()),
                    () -> flushAlert(channelId));
        } else {
            pending.merge(pass);
        }

        log.info("[AntiSpam] Rules {} triggered in channel {}: {} new members, {} new messages",
                pass.getRuleNames(), channelId, newMembers.size(), newMessages.size());

        if (properties.getAntispam().isCleanOffending()) {
            deleteMessages(channelId, newMessages);
        }
        String reason = "[AntiSpam] " + String.join(", ", pass.getReasons());
        for (String memberId : newMembers) {
            punish(memberId, reason);
        }
    }

    private void deleteMessages(String channelId, List<ChatMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        List<String> ids = messages.stream().map(ChatMessage::getId).toList();
        if (ids.size() == 1) {
            deleteOne(channelId, ids.get(0));
            return;
        }
        try {
            gateway.deleteMessages(channelId, ids);
        } catch (GatewayException e) {
            log.warn("[AntiSpam] Bulk delete of {} messages in {} failed, deleting one by one: {}", ids.size(),
                    channelId, e.getMessage());
            for (String id : ids) {
                deleteOne(channelId, id);
            }
        }
    }

    private void deleteOne(String channelId, String messageId) {
        try {
            gateway.deleteMessage(channelId, messageId);
        } catch (GatewayException e) {
            if (e.isNotFound()) {
                log.debug("[AntiSpam] Message {} was already deleted", messageId);
            } else {
                log.warn("[AntiSpam] Failed to delete message {} in {}: {}", messageId, channelId, e.getMessage());
            }
        }
    }

    private void punish(String memberId, String reason) {
        InfractionRequest request = InfractionRequest.builder()
                .type(InfractionType.MUTE)
                .userId(memberId)
                .actorId(properties.getGateway().getBotUserId())
                .reason(reason)
                .duration(properties.getAntispam().getPunishment().getRemoveAfter())
                .build();
        try {
            InfractionResult result = infractionService.apply(request);
            if (result.getStatus() == InfractionResult.Status.CONFLICT) {
                log.info("[AntiSpam] User {} is already muted", memberId);
            } else if (result.getStatus() == InfractionResult.Status.FAILED) {
                log.warn("[AntiSpam] Could not mute user {}: {}", memberId, result.getMessage());
            }
        } catch (InfractionApiException e) {
            log.error("[AntiSpam] Failed to record mute for user {}: {}", memberId, e.getMessage());
        }
    }

    // ==================== ALERTS ====================

    /**
     * Post the aggregated alert for a channel and forget the pending context.
     */
    public void flushAlert(String channelId) {
        DetectionContext context = channelLocks.withLock(channelId, () -> pendingAlerts.remove(channelId));
        if (context == null) {
            return;
        }

        Collection<ChatMessage> messages = context.getMessageList();
        StringBuilder text = new StringBuilder();
        text.append("The following user(s) were muted for spamming in <#").append(channelId).append(">: ");
        text.append(context.getMembers().entrySet().stream()
                .map(member -> member.getValue() + " (`" + member.getKey() + "`)")
                .collect(Collectors.joining(", ")));
        text.append("\n\n**Reasons:**\n");
        context.getReasons().forEach(reason -> text.append("- ").append(reason).append('\n'));

        String label = properties.getAntispam().isCleanOffending() ? "Deleted messages" : "Messages";
        if (shouldUpload(messages)) {
            Optional<String> url = modLog.uploadLog(messages, properties.getGateway().getBotUserId());
            text.append('\n').append(label).append(": ")
                    .append(url.orElse("*upload failed, " + messages.size() + " messages not logged*"));
        } else if (!messages.isEmpty()) {
            String content = messages.iterator().next().getContent();
            text.append('\n').append("**Message:**\n").append(truncate(content != null ? content : ""));
        }

        modLog.send(ModLogEntry.builder()
                .target(ModLogEntry.Target.MOD_ALERTS)
                .title("Spam detected!")
                .text(text.toString())
                .footer("Rules: " + String.join(", ", context.getRuleNames()))
                .pingEveryone(properties.getAntispam().isPingEveryone())
                .build());
        log.info("[AntiSpam] Sent alert for channel {} ({} members, {} messages)", channelId,
                context.getMembers().size(), messages.size());
    }

    private boolean shouldUpload(Collection<ChatMessage> messages) {
        if (messages.size() > 1) {
            return true;
        }
        for (ChatMessage message : messages) {
            if (message.getAttachments() != null && !message.getAttachments().isEmpty()) {
                return true;
            }
            String content = message.getContent() != null ? message.getContent() : "";
            if (content.chars().filter(c -> c == '\n').count() > MAX_INLINE_NEWLINES) {
                return true;
            }
        }
        return false;
    }

    private static String truncate(String content) {
        if (content.length() <= MAX_INLINE_LENGTH) {
            return content;
        }
        return content.substring(0, MAX_INLINE_LENGTH - 3) + "...";
    }

    boolean hasPendingAlert(String channelId) {
        return pendingAlerts.containsKey(channelId);
    }
}
