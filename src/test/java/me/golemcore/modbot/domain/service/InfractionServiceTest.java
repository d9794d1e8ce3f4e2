package me.golemcore.modbot.domain.service;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class InfractionServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String USER = "user-1";
    private static final String MOD = "mod-1";
    private static final String MUTED_ROLE = "role-muted";

    private InfractionApiPort infractionApi;
    private GatewayPort gateway;
    private ModLogPort modLog;
    private ScheduledExecutorService executor;
    private DelayedTaskScheduler scheduler;
    private SpringEventBus eventBus;
    private InfractionService service;

    @BeforeEach
    void setUp() {
        infractionApi = mock(InfractionApiPort.class);
        gateway = mock(GatewayPort.class);
        modLog = mock(ModLogPort.class);
        executor = mock(ScheduledExecutorService.class);
        eventBus = mock(SpringEventBus.class);

        BotProperties properties = new BotProperties();
        properties.getModeration().setMutedRoleId(MUTED_ROLE);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        scheduler = new DelayedTaskScheduler(clock, executor);
        InfractionNotifier notifier = new InfractionNotifier(gateway, properties);

        service = new InfractionService(infractionApi, gateway, modLog, scheduler, notifier, eventBus, properties,
                clock);

        when(infractionApi.createInfraction(any())).thenAnswer(invocation -> {
            Infraction draft = invocation.getArgument(0);
            return draft.toBuilder().id(5).build();
        });
    }

    private static Infraction activeMute(long id, Instant expiresAt) {
        return Infraction.builder()
                .id(id)
                .type(InfractionType.MUTE)
                .userId(USER)
                .actorId(MOD)
                .reason("spam")
                .insertedAt(NOW.minus(Duration.ofHours(1)))
                .expiresAt(expiresAt)
                .active(true)
                .build();
    }

    private static InfractionRequest muteRequest(Duration duration) {
        return InfractionRequest.builder()
                .type(InfractionType.MUTE)
                .userId(USER)
                .actorId(MOD)
                .reason("spam")
                .duration(duration)
                .build();
    }

    // ==================== apply ====================

    @Test
    void shouldApplyMuteAndScheduleExpiry() {
        InfractionResult result = service.apply(muteRequest(Duration.ofMinutes(10)));

        assertEquals(InfractionResult.Status.APPLIED, result.getStatus());
        assertTrue(result.getInfraction().isDmSent());
        verify(gateway).addRole(USER, MUTED_ROLE, "spam");
        verify(gateway).sendDirectMessage(eq(USER), contains("**Type:** Mute"));
        assertEquals(Optional.of(NOW.plus(Duration.ofMinutes(10))), scheduler.getFireTime("infraction-expiry:5"));
        verify(eventBus).publish(any(InfractionAppliedEvent.class));

        ArgumentCaptor<ModLogEntry> entry = ArgumentCaptor.forClass(ModLogEntry.class);
        verify(modLog).send(entry.capture());
        assertEquals("Member muted", entry.getValue().getTitle());
        assertTrue(entry.getValue().getText().contains("Duration: 10m"));
    }

    @Test
    void shouldReturnConflictForSecondActiveMute() {
        Infraction existing = activeMute(3, NOW.plusSeconds(60));
        when(infractionApi.listInfractions(true, InfractionType.MUTE, USER)).thenReturn(List.of(existing));

        InfractionResult result = service.apply(muteRequest(Duration.ofMinutes(10)));

        assertEquals(InfractionResult.Status.CONFLICT, result.getStatus());
        assertEquals("User user-1 already has an active mute infraction. See infraction #3.", result.getMessage());
        verify(infractionApi, never()).createInfraction(any());
        verifyNoInteractions(gateway);
    }

    @Test
    void shouldSerializeConcurrentAppliesForSameUser() throws Exception {
        AtomicReference<Infraction> created = new AtomicReference<>();
        when(infractionApi.listInfractions(true, InfractionType.MUTE, USER)).thenAnswer(invocation -> {
            Thread.sleep(100);
            Infraction current = created.get();
            return current != null ? List.of(current) : List.of();
        });
        doAnswer(invocation -> {
            Infraction draft = invocation.getArgument(0);
            Infraction stored = draft.toBuilder().id(5).build();
            created.set(stored);
            return stored;
        }).when(infractionApi).createInfraction(any());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch start = new CountDownLatch(1);
            Future<InfractionResult> first = pool.submit(() -> {
                start.await();
                return service.apply(muteRequest(Duration.ofMinutes(10)));
            });
            Future<InfractionResult> second = pool.submit(() -> {
                start.await();
                return service.apply(muteRequest(Duration.ofMinutes(10)));
            });
            start.countDown();

            List<InfractionResult.Status> statuses = List.of(
                    first.get(5, TimeUnit.SECONDS).getStatus(),
                    second.get(5, TimeUnit.SECONDS).getStatus());

            assertTrue(statuses.contains(InfractionResult.Status.APPLIED));
            assertTrue(statuses.contains(InfractionResult.Status.CONFLICT));
            verify(infractionApi, times(1)).createInfraction(any());
            verify(gateway, times(1)).addRole(USER, MUTED_ROLE, "spam");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldKeepInfractionWhenDirectMessageFails() {
        doThrow(new GatewayException(403, "DMs closed")).when(gateway).sendDirectMessage(anyString(), anyString());

        InfractionResult result = service.apply(muteRequest(null));

        assertEquals(InfractionResult.Status.APPLIED, result.getStatus());
        assertFalse(result.getInfraction().isDmSent());
        verify(gateway).addRole(USER, MUTED_ROLE, "spam");
        verify(infractionApi, never()).deleteInfraction(anyLong());
        assertFalse(scheduler.isScheduled("infraction-expiry:5"));
    }

    @Test
    void shouldRollBackWhenGatewayRefusesEffect() {
        doThrow(new GatewayException(403, "Missing permissions")).when(gateway)
                .addRole(anyString(), anyString(), anyString());

        InfractionResult result = service.apply(muteRequest(Duration.ofMinutes(10)));

        assertEquals(InfractionResult.Status.FAILED, result.getStatus());
        verify(infractionApi).deleteInfraction(5);
        assertFalse(scheduler.isScheduled("infraction-expiry:5"));
        verify(eventBus, never()).publish(any());

        ArgumentCaptor<ModLogEntry> entry = ArgumentCaptor.forClass(ModLogEntry.class);
        verify(modLog).send(entry.capture());
        assertEquals("Failed to apply mute", entry.getValue().getTitle());
    }

    @Test
    void shouldPropagateApiFailureOnCreate() {
        doThrow(new InfractionApiException(500, "site down")).when(infractionApi).createInfraction(any());

        assertThrows(InfractionApiException.class, () -> service.apply(muteRequest(null)));
        verifyNoInteractions(gateway);
    }

    @Test
    void shouldStoreInstantInfractionsInactive() {
        InfractionResult result = service.apply(InfractionRequest.builder()
                .type(InfractionType.KICK)
                .userId(USER)
                .actorId(MOD)
                .reason("rude")
                .build());

        assertTrue(result.isApplied());
        assertFalse(result.getInfraction().isActive());
        verify(gateway).kick(USER, "rude");
        verify(infractionApi, never()).listInfractions(any(), any(), any());
        assertEquals(0, scheduler.size());
    }

    @Test
    void shouldNotDirectMessageHiddenOrNoteInfractions() {
        service.apply(InfractionRequest.builder().type(InfractionType.NOTE).userId(USER).actorId(MOD).build());
        service.apply(InfractionRequest.builder().type(InfractionType.BAN).userId(USER).actorId(MOD).hidden(true)
                .build());

        verify(gateway, never()).sendDirectMessage(anyString(), anyString());
        verify(gateway).ban(eq(USER), any());
    }

    @Test
    void shouldRejectInvalidRequests() {
        assertThrows(IllegalArgumentException.class, () -> service.apply(InfractionRequest.builder()
                .type(InfractionType.WARNING).userId(USER).duration(Duration.ofMinutes(1)).build()));
        assertThrows(IllegalArgumentException.class, () -> service.apply(muteRequest(Duration.ZERO)));
        assertThrows(IllegalArgumentException.class, () -> service.apply(InfractionRequest.builder()
                .type(InfractionType.MUTE).build()));
        verifyNoInteractions(infractionApi);
    }

    // ==================== deactivate ====================

    @Test
    void shouldDeactivateExpiredMute() {
        Infraction mute = activeMute(7, NOW);
        when(infractionApi.getInfraction(7)).thenReturn(mute);

        DeactivationSummary summary = service.deactivate(mute, null, true);

        assertFalse(summary.isFailed());
        verify(gateway).removeRole(eq(USER), eq(MUTED_ROLE), anyString());
        verify(gateway).sendDirectMessage(eq(USER), contains("You have been unmuted"));
        verify(infractionApi).deactivateInfraction(7);

        ArgumentCaptor<ModLogEntry> entry = ArgumentCaptor.forClass(ModLogEntry.class);
        verify(modLog).send(entry.capture());
        assertEquals("Mute expired", entry.getValue().getTitle());
        assertEquals("ID: 7", entry.getValue().getFooter());

        ArgumentCaptor<InfractionDeactivatedEvent> event = ArgumentCaptor.forClass(InfractionDeactivatedEvent.class);
        verify(eventBus).publish(event.capture());
        assertFalse(event.getValue().pardoned());
    }

    @Test
    void shouldBeIdempotentWhenDeactivatedTwice() {
        Infraction mute = activeMute(7, NOW);
        when(infractionApi.getInfraction(7)).thenReturn(mute, mute.toBuilder().active(false).build());

        service.deactivate(mute, null, true);
        DeactivationSummary second = service.deactivate(mute, null, true);

        assertTrue(second.isAlreadyInactive());
        verify(gateway, times(1)).removeRole(anyString(), anyString(), anyString());
        verify(infractionApi, times(1)).deactivateInfraction(7);
        verify(modLog, times(1)).send(any());
    }

    @Test
    void shouldReportApiFailureInSummary() {
        Infraction mute = activeMute(7, NOW);
        when(infractionApi.getInfraction(7)).thenReturn(mute);
        when(infractionApi.deactivateInfraction(7)).thenThrow(new InfractionApiException(500, "boom"));

        DeactivationSummary summary = service.deactivate(mute, null, true);

        assertTrue(summary.isFailed());
        assertEquals("API request failed with status 500", summary.getLines().get("Failure"));
        ArgumentCaptor<ModLogEntry> entry = ArgumentCaptor.forClass(ModLogEntry.class);
        verify(modLog).send(entry.capture());
        assertEquals("Mute expiration failed", entry.getValue().getTitle());
        verify(eventBus, never()).publish(any());
    }

    @Test
    void shouldUseLocalCopyWhenRefreshFails() {
        Infraction mute = activeMute(7, NOW);
        when(infractionApi.getInfraction(7)).thenThrow(new InfractionApiException(-1, "timeout"));

        DeactivationSummary summary = service.deactivate(mute, null, false);

        assertFalse(summary.isFailed());
        verify(infractionApi).deactivateInfraction(7);
        verifyNoInteractions(modLog);
    }

    @Test
    void shouldNoteMissingBanInsteadOfFailing() {
        Infraction ban = activeMute(8, null).toBuilder().type(InfractionType.BAN).build();
        when(infractionApi.getInfraction(8)).thenReturn(ban);
        doThrow(new GatewayException(404, "Unknown Ban")).when(gateway).unban(anyString(), anyString());

        DeactivationSummary summary = service.deactivate(ban, "Pardoned by mod-2", false);

        assertFalse(summary.isFailed());
        assertEquals("User was not banned", summary.getLines().get("Note"));
        verify(infractionApi).deactivateInfraction(8);
    }

    @Test
    void shouldRunDeactivationWhenExpiryTaskFires() {
        InfractionResult result = service.apply(muteRequest(Duration.ofMinutes(10)));
        when(infractionApi.getInfraction(5)).thenReturn(result.getInfraction());
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).schedule(task.capture(), eq(Duration.ofMinutes(10).toMillis()), eq(TimeUnit.MILLISECONDS));

        task.getValue().run();

        verify(infractionApi).deactivateInfraction(5);
        assertFalse(scheduler.isScheduled("infraction-expiry:5"));
    }

    // ==================== pardon ====================

    @Test
    void shouldPardonActiveMute() {
        Infraction mute = activeMute(9, NOW.plusSeconds(600));
        when(infractionApi.listInfractions(true, InfractionType.MUTE, USER)).thenReturn(List.of(mute));
        when(infractionApi.getInfraction(9)).thenReturn(mute);
        service.scheduleExpiration(mute);

        InfractionResult result = service.pardon(InfractionType.MUTE, USER, MOD);

        assertEquals(InfractionResult.Status.PARDONED, result.getStatus());
        assertEquals("Pardoned infraction #9.", result.getMessage());
        assertFalse(scheduler.isScheduled("infraction-expiry:9"));
        ArgumentCaptor<ModLogEntry> entry = ArgumentCaptor.forClass(ModLogEntry.class);
        verify(modLog).send(entry.capture());
        assertEquals("Mute pardoned", entry.getValue().getTitle());
        assertTrue(entry.getValue().getText().contains("Pardon: Pardoned by mod-1"));
    }

    @Test
    void shouldReturnNotFoundWhenNothingToPardon() {
        InfractionResult result = service.pardon(InfractionType.BAN, USER, MOD);

        assertEquals(InfractionResult.Status.NOT_FOUND, result.getStatus());
        verifyNoInteractions(gateway);
    }

    @Test
    void shouldRejectPardonOfInstantType() {
        assertThrows(IllegalArgumentException.class, () -> service.pardon(InfractionType.KICK, USER, MOD));
    }

    // ==================== reschedule ====================

    @Test
    void shouldRescheduleWithStoredExpiry() {
        Instant overdue = NOW.minusSeconds(30);
        Instant future = NOW.plus(Duration.ofDays(2));
        when(infractionApi.listInfractions(true, null, null)).thenReturn(List.of(
                activeMute(1, overdue),
                activeMute(2, future),
                activeMute(3, null)));

        int scheduled = service.rescheduleInfractions();

        assertEquals(2, scheduled);
        assertEquals(Optional.of(overdue), scheduler.getFireTime("infraction-expiry:1"));
        assertEquals(Optional.of(future), scheduler.getFireTime("infraction-expiry:2"));
        assertFalse(scheduler.isScheduled("infraction-expiry:3"));
        verify(executor).schedule(any(Runnable.class), eq(0L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldSurviveApiFailureOnStartup() {
        when(infractionApi.listInfractions(true, null, null)).thenThrow(new InfractionApiException(503, "down"));

        assertDoesNotThrow(() -> service.rescheduleOnStartup());
        assertEquals(0, scheduler.size());
    }

    // ==================== member join ====================

    @Test
    void shouldReapplyMuteOnRejoin() {
        Infraction mute = activeMute(4, NOW.plus(Duration.ofHours(1)));
        when(infractionApi.listInfractions(true, InfractionType.MUTE, USER)).thenReturn(List.of(mute));

        service.onMemberJoin(USER);

        verify(gateway).addRole(USER, MUTED_ROLE, "spam");
        verify(infractionApi, never()).deactivateInfraction(anyLong());
    }

    @Test
    void shouldDeactivateNearlyExpiredMuteOnRejoin() {
        Infraction mute = activeMute(4, NOW.plusSeconds(30));
        when(infractionApi.listInfractions(true, InfractionType.MUTE, USER)).thenReturn(List.of(mute));
        when(infractionApi.getInfraction(4)).thenReturn(mute);

        service.onMemberJoin(USER);

        verify(gateway, never()).addRole(anyString(), anyString(), anyString());
        verify(infractionApi).deactivateInfraction(4);
    }

    @Test
    void shouldHoldUserLockWhileReapplyingOnRejoin() throws Exception {
        Infraction mute = activeMute(4, NOW.plus(Duration.ofHours(1)));
        when(infractionApi.getInfraction(4)).thenReturn(mute);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        AtomicBoolean firstLookup = new AtomicBoolean(true);
        AtomicReference<Future<InfractionResult>> pardon = new AtomicReference<>();
        AtomicBoolean pardonedDuringLookup = new AtomicBoolean();
        when(infractionApi.listInfractions(true, InfractionType.MUTE, USER)).thenAnswer(invocation -> {
            if (firstLookup.compareAndSet(true, false)) {
                pardon.set(pool.submit(() -> service.pardon(InfractionType.MUTE, USER, MOD)));
                try {
                    pardon.get().get(200, TimeUnit.MILLISECONDS);
                    pardonedDuringLookup.set(true);
                } catch (TimeoutException e) {
                    pardonedDuringLookup.set(false);
                }
            }
            return List.of(mute);
        });

        try {
            service.onMemberJoin(USER);
            InfractionResult result = pardon.get().get(5, TimeUnit.SECONDS);

            assertFalse(pardonedDuringLookup.get());
            assertEquals(InfractionResult.Status.PARDONED, result.getStatus());
            InOrder order = inOrder(gateway);
            order.verify(gateway).addRole(USER, MUTED_ROLE, "spam");
            order.verify(gateway).removeRole(eq(USER), eq(MUTED_ROLE), anyString());
        } finally {
            pool.shutdownNow();
        }
    }
}
