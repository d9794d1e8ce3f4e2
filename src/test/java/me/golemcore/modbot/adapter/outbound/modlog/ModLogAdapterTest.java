package me.golemcore.modbot.adapter.outbound.modlog;

import me.golemcore.modbot.adapter.outbound.site.DeletedMessageLog;
import me.golemcore.modbot.adapter.outbound.site.SiteApi;
import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.ModLogEntry;
import me.golemcore.modbot.infrastructure.config.BotProperties;
import me.golemcore.modbot.port.outbound.GatewayException;
import me.golemcore.modbot.port.outbound.GatewayPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static me.golemcore.modbot.testsupport.TestMessages.message;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ModLogAdapterTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private GatewayPort gateway;
    private SiteApi siteApi;
    private BotProperties properties;
    private ModLogAdapter adapter;

    @BeforeEach
    void setUp() {
        gateway = mock(GatewayPort.class);
        siteApi = mock(SiteApi.class);
        properties = new BotProperties();
        properties.getModeration().setModLogChannelId("mod-log");
        properties.getModeration().setModAlertsChannelId("mod-alerts");
        properties.getModeration().setModeratorsRoleId("mods");
        properties.getSite().setLogsViewUrl("https://site.test/logs/");
        adapter = new ModLogAdapter(gateway, siteApi, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== send ====================

    @Test
    void shouldRouteAlertsWithEveryonePing() {
        adapter.send(ModLogEntry.builder()
                .target(ModLogEntry.Target.MOD_ALERTS)
                .title("Spam detected!")
                .text("details")
                .footer("Rules: burst")
                .pingEveryone(true)
                .build());

        verify(gateway).sendMessage("mod-alerts", "@everyone\n**Spam detected!**\ndetails\n_Rules: burst_");
    }

    @Test
    void shouldPingModeratorRole() {
        String text = ModLogAdapter.format(ModLogEntry.builder().title("T").text("x").pingModerators(true).build(),
                "mods");

        assertEquals("<@&mods>\n**T**\nx", text);
    }

    @Test
    void shouldPostLogEntriesToModLog() {
        adapter.send(ModLogEntry.log("Member muted", "Member: u1"));

        verify(gateway).sendMessage("mod-log", "**Member muted**\nMember: u1");
    }

    @Test
    void shouldSwallowDeliveryFailures() {
        doThrow(new GatewayException(500, "down")).when(gateway).sendMessage(anyString(), anyString());

        assertDoesNotThrow(() -> adapter.send(ModLogEntry.log("t", "x")));
    }

    @Test
    void shouldDropEntryWithoutConfiguredChannel() {
        properties.getModeration().setModLogChannelId("");

        adapter.send(ModLogEntry.log("t", "x"));

        verifyNoInteractions(gateway);
    }

    // ==================== uploadLog ====================

    @Test
    void shouldUploadDeletedMessagesAndReturnViewUrl() {
        when(siteApi.uploadDeletedMessages(any())).thenReturn(DeletedMessageLog.builder().id(77L).build());
        ChatMessage spam = message("u1", 0, "buy now");

        Optional<String> url = adapter.uploadLog(List.of(spam), "bot-1");

        assertEquals(Optional.of("https://site.test/logs/77"), url);
        ArgumentCaptor<DeletedMessageLog> request = ArgumentCaptor.forClass(DeletedMessageLog.class);
        verify(siteApi).uploadDeletedMessages(request.capture());
        assertEquals("bot-1", request.getValue().getActor());
        assertEquals(NOW, request.getValue().getCreation());
        assertEquals(spam.getId(), request.getValue().getMessages().get(0).getId());
        assertEquals("buy now", request.getValue().getMessages().get(0).getContent());
    }

    @Test
    void shouldReturnEmptyWhenUploadFails() {
        when(siteApi.uploadDeletedMessages(any())).thenThrow(new IllegalStateException("site down"));

        assertTrue(adapter.uploadLog(List.of(message("u1", 0, "x")), "bot-1").isEmpty());
    }
}
