package me.golemcore.modbot.adapter.inbound.webhook.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.modbot.domain.model.ChatMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Request body for {@code POST /api/events/messages} and
 * {@code POST /api/events/messages/edit}: one chat message as seen by the
 * gateway bridge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEventPayload {

    private String id;
    private String channelId;
    private String authorId;
    private String authorName;
    private boolean authorBot;
    private List<String> authorRoleIds;
    private Instant timestamp;
    private String content;
    private List<String> attachments;
    private List<MentionPayload> mentions;
    private List<String> roleMentions;
    private List<String> embedUrls;
    private String replyToAuthorId;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MentionPayload {
        private String userId;
        private boolean bot;
    }

    public ChatMessage toChatMessage() {
        List<ChatMessage.Mention> mapped = new ArrayList<>();
        if (mentions != null) {
            for (MentionPayload mention : mentions) {
                mapped.add(new ChatMessage.Mention(mention.getUserId(), mention.isBot()));
            }
        }
        return ChatMessage.builder()
                .id(id)
                .channelId(channelId)
                .authorId(authorId)
                .authorName(authorName != null ? authorName : authorId)
                .authorBot(authorBot)
                .authorRoleIds(copy(authorRoleIds))
                .timestamp(timestamp)
                .content(content != null ? content : "")
                .attachments(copy(attachments))
                .mentions(mapped)
                .roleMentions(copy(roleMentions))
                .embedUrls(copy(embedUrls))
                .replyToAuthorId(replyToAuthorId)
                .build();
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
