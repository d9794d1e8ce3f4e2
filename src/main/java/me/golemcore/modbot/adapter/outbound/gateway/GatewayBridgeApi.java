package me.golemcore.modbot.adapter.outbound.gateway;

import feign.Headers;
import feign.Param;
import feign.RequestLine;

import java.util.Map;

/**
 * Feign contract for the chat gateway bridge. Audit reasons travel as a query
 * parameter on {@code DELETE} requests and in the body otherwise.
 */
public interface GatewayBridgeApi {

    @RequestLine("DELETE /channels/{channelId}/messages/{messageId}")
    void deleteMessage(@Param("channelId") String channelId, @Param("messageId") String messageId);

    @RequestLine("POST /channels/{channelId}/messages/bulk-delete")
    @Headers("Content-Type: application/json")
    void bulkDeleteMessages(@Param("channelId") String channelId, Map<String, Object> body);

    @RequestLine("POST /channels/{channelId}/messages")
    @Headers("Content-Type: application/json")
    void sendMessage(@Param("channelId") String channelId, Map<String, Object> body);

    @RequestLine("POST /channels/{channelId}/webhook-messages")
    @Headers("Content-Type: application/json")
    void sendWebhookMessage(@Param("channelId") String channelId, Map<String, Object> body);

    @RequestLine("PUT /members/{userId}/roles/{roleId}")
    @Headers("Content-Type: application/json")
    void addRole(@Param("userId") String userId, @Param("roleId") String roleId, Map<String, Object> body);

    @RequestLine("DELETE /members/{userId}/roles/{roleId}?reason={reason}")
    void removeRole(@Param("userId") String userId, @Param("roleId") String roleId,
            @Param("reason") String reason);

    @RequestLine("PATCH /members/{userId}")
    @Headers("Content-Type: application/json")
    void updateMember(@Param("userId") String userId, Map<String, Object> body);

    @RequestLine("DELETE /members/{userId}?reason={reason}")
    void kick(@Param("userId") String userId, @Param("reason") String reason);

    @RequestLine("PUT /bans/{userId}")
    @Headers("Content-Type: application/json")
    void ban(@Param("userId") String userId, Map<String, Object> body);

    @RequestLine("DELETE /bans/{userId}?reason={reason}")
    void unban(@Param("userId") String userId, @Param("reason") String reason);

    @RequestLine("POST /users/{userId}/dm")
    @Headers("Content-Type: application/json")
    void sendDirectMessage(@Param("userId") String userId, Map<String, Object> body);
}
