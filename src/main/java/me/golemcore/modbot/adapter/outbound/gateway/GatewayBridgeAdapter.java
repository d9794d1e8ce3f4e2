package me.golemcore.modbot.adapter.outbound.gateway;

import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.modbot.port.outbound.GatewayException;
import me.golemcore.modbot.port.outbound.GatewayPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GatewayPort} over the gateway bridge HTTP API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GatewayBridgeAdapter implements GatewayPort {

    private static final String REASON = "reason";
    private static final String CONTENT = "content";

    private final GatewayBridgeApi api;

    @Override
    public void deleteMessage(String channelId, String messageId) {
        call("delete message " + messageId, () -> api.deleteMessage(channelId, messageId));
    }

    @Override
    public void deleteMessages(String channelId, List<String> messageIds) {
        call("bulk delete " + messageIds.size() + " messages",
                () -> api.bulkDeleteMessages(channelId, Map.of("messages", List.copyOf(messageIds))));
    }

    @Override
    public void addRole(String userId, String roleId, String reason) {
        call("add role " + roleId + " to " + userId, () -> api.addRole(userId, roleId, body(REASON, reason)));
    }

    @Override
    public void removeRole(String userId, String roleId, String reason) {
        call("remove role " + roleId + " from " + userId, () -> api.removeRole(userId, roleId, reason));
    }

    @Override
    public void ban(String userId, String reason) {
        call("ban " + userId, () -> api.ban(userId, body(REASON, reason)));
    }

    @Override
    public void unban(String userId, String reason) {
        call("unban " + userId, () -> api.unban(userId, reason));
    }

    @Override
    public void kick(String userId, String reason) {
        call("kick " + userId, () -> api.kick(userId, reason));
    }

    @Override
    public void setNickname(String userId, String nickname, String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("nick", nickname);
        body.put(REASON, reason);
        call("change nickname of " + userId, () -> api.updateMember(userId, body));
    }

    @Override
    public void sendDirectMessage(String userId, String content) {
        call("DM " + userId, () -> api.sendDirectMessage(userId, body(CONTENT, content)));
    }

    @Override
    public void sendMessage(String channelId, String content) {
        call("send message to " + channelId, () -> api.sendMessage(channelId, body(CONTENT, content)));
    }

    @Override
    public void sendAs(String channelId, String username, String avatarUrl, String content) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("avatar_url", avatarUrl);
        body.put(CONTENT, content);
        call("relay message to " + channelId, () -> api.sendWebhookMessage(channelId, body));
    }

    private static Map<String, Object> body(String key, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(key, value);
        return body;
    }

    private void call(String action, Runnable request) {
        try {
            request.run();
        } catch (FeignException e) {
            log.debug("[Gateway] Failed to {} (status {})", action, e.status());
            throw new GatewayException(e.status(), "Failed to " + action + ": " + e.getMessage(), e);
        }
    }
}
