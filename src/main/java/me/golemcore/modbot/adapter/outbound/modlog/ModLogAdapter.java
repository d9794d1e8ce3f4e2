package me.golemcore.modbot.adapter.outbound.modlog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.modbot.adapter.outbound.site.DeletedMessageLog;
import me.golemcore.modbot.adapter.outbound.site.SiteApi;
import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.ModLogEntry;
import me.golemcore.modbot.infrastructure.config.BotProperties;
import me.golemcore.modbot.port.outbound.GatewayPort;
import me.golemcore.modbot.port.outbound.ModLogPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Posts staff log entries through the gateway and uploads deleted-message
 * logs to the site. Never throws.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModLogAdapter implements ModLogPort {

    private final GatewayPort gateway;
    private final SiteApi siteApi;
    private final BotProperties properties;
    private final Clock clock;

    @Override
    public void send(ModLogEntry entry) {
        BotProperties.ModerationProperties moderation = properties.getModeration();
        String channelId = entry.getTarget() == ModLogEntry.Target.MOD_ALERTS
                ? moderation.getModAlertsChannelId()
                : moderation.getModLogChannelId();
        if (channelId == null || channelId.isBlank()) {
            log.warn("[ModLog] No channel configured for {}, dropping entry '{}'", entry.getTarget(),
                    entry.getTitle());
            return;
        }

        try {
            gateway.sendMessage(channelId, format(entry, moderation.getModeratorsRoleId()));
        } catch (RuntimeException e) { // NOSONAR - log delivery must not abort moderation actions
            log.error("[ModLog] Failed to post '{}' to {}: {}", entry.getTitle(), channelId, e.getMessage());
        }
    }

    @Override
    public Optional<String> uploadLog(Collection<ChatMessage> messages, String actorId) {
        List<DeletedMessageLog.DeletedMessage> entries = new ArrayList<>();
        for (ChatMessage message : messages) {
            entries.add(new DeletedMessageLog.DeletedMessage(message.getId(), message.getAuthorId(),
                    message.getChannelId(), message.getContent(), message.getAttachments()));
        }
        DeletedMessageLog request = DeletedMessageLog.builder()
                .actor(actorId)
                .creation(clock.instant())
                .messages(entries)
                .build();

        try {
            DeletedMessageLog stored = siteApi.uploadDeletedMessages(request);
            if (stored == null || stored.getId() == null) {
                log.warn("[ModLog] Log upload returned no id");
                return Optional.empty();
            }
            return Optional.of(properties.getSite().getLogsViewUrl() + stored.getId());
        } catch (RuntimeException e) { // NOSONAR - alert is still sent without the log link
            log.error("[ModLog] Failed to upload {} deleted messages: {}", messages.size(), e.getMessage());
            return Optional.empty();
        }
    }

    static String format(ModLogEntry entry, String moderatorsRoleId) {
        StringBuilder sb = new StringBuilder();
        if (entry.isPingEveryone()) {
            sb.append("@everyone\n");
        } else if (entry.isPingModerators() && moderatorsRoleId != null && !moderatorsRoleId.isBlank()) {
            sb.append("<@&").append(moderatorsRoleId).append(">\n");
        }
        if (entry.getTitle() != null) {
            sb.append("**").append(entry.getTitle()).append("**\n");
        }
        if (entry.getText() != null) {
            sb.append(entry.getText());
        }
        if (entry.getFooter() != null && !entry.getFooter().isBlank()) {
            sb.append("\n_").append(entry.getFooter()).append('_');
        }
        return sb.toString();
    }
}
