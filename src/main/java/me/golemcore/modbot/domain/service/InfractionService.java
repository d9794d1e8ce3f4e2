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
import me.golemcore.modbot.domain.model.DeactivationSummary;
import me.golemcore.modbot.domain.model.Infraction;
import me.golemcore.modbot.domain.model.InfractionAppliedEvent;
import me.golemcore.modbot.domain.model.InfractionDeactivatedEvent;
import me.golemcore.modbot.domain.model.InfractionRequest;
import me.golemcore.modbot.domain.model.InfractionResult;
import me.golemcore.modbot.domain.model.InfractionType;
import me.golemcore.modbot.domain.model.ModLogEntry;
import me.golemcore.modbot.infrastructure.config.BotProperties;
import me.golemcore.modbot.infrastructure.event.SpringEventBus;
import me.golemcore.modbot.port.outbound.GatewayException;
import me.golemcore.modbot.port.outbound.GatewayPort;
import me.golemcore.modbot.port.outbound.InfractionApiException;
import me.golemcore.modbot.port.outbound.InfractionApiPort;
import me.golemcore.modbot.port.outbound.ModLogPort;
import me.golemcore.modbot.scheduling.DelayedTaskScheduler;
import me.golemcore.modbot.util.DurationParser;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle of moderation infractions: apply, expire, pardon, and re-arm
 * expiry after a restart.
 *
 * <p>
 * States are {@code NONE -> ACTIVE -> {EXPIRED, PARDONED}}; both terminal
 * states are stored as {@code active=false}. The site API is the source of
 * truth, and the expiry timers held by {@link DelayedTaskScheduler} are only a
 * cache of it, rebuilt by {@link #rescheduleInfractions()}.
 *
 * <p>
 * The "at most one active infraction of an exclusive type" check spans two API
 * calls, so every mutation for a user runs under that user's lock.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class InfractionService {

    private final InfractionApiPort infractionApi;
    private final GatewayPort gateway;
    private final ModLogPort modLog;
    private final DelayedTaskScheduler scheduler;
    private final InfractionNotifier notifier;
    private final SpringEventBus eventBus;
    private final BotProperties properties;
    private final Clock clock;
    private final KeyedLocks userLocks = new KeyedLocks();

    public InfractionService(InfractionApiPort infractionApi, GatewayPort gateway, ModLogPort modLog,
            DelayedTaskScheduler scheduler, InfractionNotifier notifier, SpringEventBus eventBus,
            BotProperties properties, Clock clock) {
        this.infractionApi = infractionApi;
        this.gateway = gateway;
        this.modLog = modLog;
        this.scheduler = scheduler;
        this.notifier = notifier;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== APPLY ====================

    /**
     * Record a sanction and put it into effect.
     *
     * @return APPLIED, CONFLICT when the user already has an active infraction
     *         of the same exclusive type, or FAILED when the gateway refused the
     *         action (the record is removed again)
     * @throws InfractionApiException
     *             when the site API cannot be reached or rejects the request
     */
    public InfractionResult apply(InfractionRequest request) {
        validate(request);
        return userLocks.withLock(request.getUserId(), () -> applyLocked(request));
    }

    private InfractionResult applyLocked(InfractionRequest request) {
        InfractionType type = request.getType();
        if (type.isExclusive()) {
            Optional<Infraction> existing = findActive(type, request.getUserId());
            if (existing.isPresent()) {
                log.info("[Infractions] User {} already has active {} #{}", request.getUserId(),
                        type.apiName(), existing.get().getId());
                return InfractionResult.conflict(existing.get());
            }
        }

        Instant now = clock.instant();
        Infraction draft = Infraction.builder()
                .type(type)
                .userId(request.getUserId())
                .actorId(request.getActorId())
                .reason(request.getReason())
                .insertedAt(now)
                .expiresAt(request.getDuration() != null ? now.plus(request.getDuration()) : null)
                .active(!type.isInstant())
                .hidden(request.isHidden())
                .build();
        Infraction infraction = infractionApi.createInfraction(draft);

        if (notifier.shouldNotify(infraction)) {
            infraction.setDmSent(notifier.notifyApplied(infraction));
        }

        try {
            applyEffect(infraction);
        } catch (GatewayException e) {
            log.error("[Infractions] Failed to apply {} to user {}: {}", type.apiName(), infraction.getUserId(),
                    e.getMessage());
            rollback(infraction);
            modLog.send(ModLogEntry.log("Failed to apply " + type.apiName(),
                    "Member: " + infraction.getUserId() + "\nActor: " + infraction.getActorId()
                            + "\nReason: " + infraction.getReason() + "\nError: " + e.getMessage()));
            return InfractionResult.failed("Failed to apply " + type.apiName() + " to user "
                    + infraction.getUserId() + ": " + e.getMessage());
        }

        if (infraction.isExpirable()) {
            scheduleExpiration(infraction);
        }

        modLog.send(ModLogEntry.log("Member " + type.getPastTense(), describeApplied(infraction)));
        eventBus.publish(new InfractionAppliedEvent(infraction));
        log.info("[Infractions] Applied {} #{} to user {}", type.apiName(), infraction.getId(),
                infraction.getUserId());
        return InfractionResult.applied(infraction);
    }

    private void validate(InfractionRequest request) {
        if (request.getType() == null) {
            throw new IllegalArgumentException("Infraction type is required");
        }
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        if (request.getDuration() != null) {
            if (request.getType().isInstant()) {
                throw new IllegalArgumentException(request.getType().apiName() + " infractions cannot expire");
            }
            if (request.getDuration().isNegative() || request.getDuration().isZero()) {
                throw new IllegalArgumentException("Duration must be positive");
            }
        }
    }

    private void applyEffect(Infraction infraction) {
        String reason = infraction.getReason();
        switch (infraction.getType()) {
        case MUTE -> gateway.addRole(infraction.getUserId(), properties.getModeration().getMutedRoleId(), reason);
        case BAN -> gateway.ban(infraction.getUserId(), reason);
        case KICK -> gateway.kick(infraction.getUserId(), reason);
        case SUPERSTAR -> gateway.setNickname(infraction.getUserId(),
                properties.getModeration().getSuperstarNickname(), reason);
        case WATCH, WARNING, NOTE -> {
            // record only
        }
        }
    }

    private void rollback(Infraction infraction) {
        try {
            infractionApi.deleteInfraction(infraction.getId());
        } catch (InfractionApiException e) {
            log.error("[Infractions] Could not delete unapplied infraction #{}: {}", infraction.getId(),
                    e.getMessage());
        }
    }

    // ==================== DEACTIVATE ====================

    /**
     * Reverse an infraction's effect and mark it inactive.
     *
     * <p>
     * Safe to call repeatedly: an infraction already inactive in the API only has
     * its pending timer cancelled. Gateway and API failures are reported in the
     * summary, not thrown.
     *
     * @param pardonReason
     *            {@code null} for a natural expiry
     * @param sendLog
     *            post the outcome to the mod log
     */
    public DeactivationSummary deactivate(Infraction infraction, String pardonReason, boolean sendLog) {
        return userLocks.withLock(infraction.getUserId(), () -> deactivateLocked(infraction, pardonReason, sendLog));
    }

    private DeactivationSummary deactivateLocked(Infraction infraction, String pardonReason, boolean sendLog) {
        Infraction current = refresh(infraction);
        if (!current.isActive()) {
            scheduler.cancel(current.getTaskId());
            log.debug("[Infractions] Infraction #{} is already inactive", current.getId());
            return DeactivationSummary.alreadyInactive(current);
        }

        boolean expired = pardonReason == null;
        DeactivationSummary summary = new DeactivationSummary(current);
        summary.put("Member", current.getUserId());
        summary.put("Actor", current.getActorId());
        summary.put("Reason", current.getReason());
        if (!expired) {
            summary.put("Pardon", pardonReason);
        }

        reverseEffect(current, summary);

        try {
            infractionApi.deactivateInfraction(current.getId());
            current.setActive(false);
        } catch (InfractionApiException e) {
            log.error("[Infractions] Failed to deactivate infraction #{} in the API: {}", current.getId(),
                    e.getMessage());
            summary.addFailure("API request failed with status " + e.getStatus());
        }

        scheduler.cancel(current.getTaskId());

        if (sendLog) {
            String verb = expired ? "expiration" : "pardon";
            String title = summary.isFailed()
                    ? capitalizedType(current) + " " + verb + " failed"
                    : capitalizedType(current) + (expired ? " expired" : " pardoned");
            modLog.send(ModLogEntry.builder()
                    .target(ModLogEntry.Target.MOD_LOG)
                    .title(title)
                    .text(summary.render())
                    .footer("ID: " + current.getId())
                    .build());
        }

        if (!current.isActive()) {
            eventBus.publish(new InfractionDeactivatedEvent(current, !expired));
        }
        log.info("[Infractions] Deactivated {} #{} for user {}{}", current.getType().apiName(), current.getId(),
                current.getUserId(), summary.isFailed() ? " with failures" : "");
        return summary;
    }

    private Infraction refresh(Infraction infraction) {
        try {
            return infractionApi.getInfraction(infraction.getId());
        } catch (InfractionApiException e) {
            log.warn("[Infractions] Could not refresh infraction #{}, using local copy: {}", infraction.getId(),
                    e.getMessage());
            return infraction.toBuilder().build();
        }
    }

    private void reverseEffect(Infraction infraction, DeactivationSummary summary) {
        String reason = "Infraction #" + infraction.getId() + " deactivated";
        try {
            switch (infraction.getType()) {
            case MUTE -> {
                gateway.removeRole(infraction.getUserId(), properties.getModeration().getMutedRoleId(), reason);
                summary.put("DM", notifier.notifyPardoned(infraction) ? "Sent" : "**Failed**");
            }
            case BAN -> gateway.unban(infraction.getUserId(), reason);
            case SUPERSTAR -> {
                gateway.setNickname(infraction.getUserId(), null, reason);
                summary.put("DM", notifier.notifyPardoned(infraction) ? "Sent" : "**Failed**");
            }
            default -> {
                // nothing to undo
            }
            }
        } catch (GatewayException e) {
            if (e.isNotFound()) {
                String note = infraction.getType() == InfractionType.BAN
                        ? "User was not banned"
                        : "User was not found in the guild";
                log.info("[Infractions] {} while deactivating #{}", note, infraction.getId());
                summary.put("Note", note);
            } else {
                log.warn("[Infractions] Failed to reverse {} #{}: {}", infraction.getType().apiName(),
                        infraction.getId(), e.getMessage());
                summary.addFailure(e.getMessage());
            }
        }
    }

    // ==================== PARDON ====================

    /**
     * Lift a user's active infraction of the given type before it expires.
     */
    public InfractionResult pardon(InfractionType type, String userId, String actorId) {
        if (!type.isExclusive()) {
            throw new IllegalArgumentException(type.apiName() + " infractions cannot be pardoned");
        }
        return userLocks.withLock(userId, () -> {
            Optional<Infraction> active = findActive(type, userId);
            if (active.isEmpty()) {
                return InfractionResult.notFound(type, userId);
            }
            DeactivationSummary summary = deactivate(active.get(), "Pardoned by " + actorId, true);
            String message = summary.isFailed()
                    ? "Pardoned infraction #" + active.get().getId() + " with failures: "
                            + summary.getLines().get("Failure")
                    : "Pardoned infraction #" + active.get().getId() + ".";
            return InfractionResult.pardoned(summary.getInfraction(), message);
        });
    }

    // ==================== SCHEDULING ====================

    /**
     * Re-arm expiry for every active infraction with an expiry time, keeping the
     * stored {@code expiresAt}.
     *
     * @return number of scheduled infractions
     * @throws InfractionApiException
     *             when the active infractions cannot be listed
     */
    public int rescheduleInfractions() {
        List<Infraction> active = infractionApi.listInfractions(true, null, null);
        int scheduled = 0;
        for (Infraction infraction : active) {
            if (infraction.isExpirable()) {
                scheduleExpiration(infraction);
                scheduled++;
            }
        }
        log.info("[Infractions] Rescheduled {} of {} active infractions", scheduled, active.size());
        return scheduled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void rescheduleOnStartup() {
        try {
            rescheduleInfractions();
        } catch (InfractionApiException e) {
            log.error("[Infractions] Could not reschedule infractions on startup: {}", e.getMessage());
        }
    }

    public void scheduleExpiration(Infraction infraction) {
        scheduler.schedule(infraction.getTaskId(), infraction.getExpiresAt(),
                () -> deactivate(infraction, null, true));
    }

    // ==================== MEMBER EVENTS ====================

    /**
     * Restore an active mute or superstar nickname for a member who rejoined.
     * A sanction about to expire is deactivated instead.
     */
    public void onMemberJoin(String userId) {
        for (InfractionType type : List.of(InfractionType.MUTE, InfractionType.SUPERSTAR)) {
            userLocks.withLock(userId, () -> reapplyOnJoin(type, userId));
        }
    }

    private void reapplyOnJoin(InfractionType type, String userId) {
        Optional<Infraction> active = findActive(type, userId);
        if (active.isEmpty()) {
            return;
        }
        Infraction infraction = active.get();
        if (infraction.getExpiresAt() != null) {
            Duration remaining = Duration.between(clock.instant(), infraction.getExpiresAt());
            if (remaining.compareTo(properties.getModeration().getReapplyThreshold()) < 0) {
                log.info("[Infractions] {} #{} nearly expired, deactivating for rejoined user {}",
                        type.apiName(), infraction.getId(), userId);
                deactivate(infraction, null, true);
                return;
            }
        }
        try {
            applyEffect(infraction);
            log.info("[Infractions] Reapplied {} #{} to rejoined user {}", type.apiName(), infraction.getId(),
                    userId);
        } catch (GatewayException e) {
            log.warn("[Infractions] Failed to reapply {} #{}: {}", type.apiName(), infraction.getId(),
                    e.getMessage());
        }
    }

    public Optional<Infraction> findActive(InfractionType type, String userId) {
        List<Infraction> active = infractionApi.listInfractions(true, type, userId);
        return active.isEmpty() ? Optional.empty() : Optional.of(active.get(0));
    }

    private String describeApplied(Infraction infraction) {
        StringBuilder sb = new StringBuilder();
        sb.append("Member: ").append(infraction.getUserId()).append('\n');
        sb.append("Actor: ").append(infraction.getActorId()).append('\n');
        sb.append("DM: ").append(infraction.isDmSent() ? "Sent" : "**Failed**").append('\n');
        sb.append("Reason: ").append(infraction.getReason());
        if (infraction.getExpiresAt() != null) {
            sb.append("\nDuration: ")
                    .append(DurationParser.format(Duration.between(infraction.getInsertedAt(),
                            infraction.getExpiresAt())))
                    .append("\nExpires: ").append(infraction.getExpiresAt());
        }
        return sb.toString();
    }

    private static String capitalizedType(Infraction infraction) {
        String name = infraction.getType().apiName();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
