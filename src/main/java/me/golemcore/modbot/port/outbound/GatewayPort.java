package me.golemcore.modbot.port.outbound;

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

import java.util.List;

/**
 * Port for the actions the moderation core performs on the chat server. Every
 * call is blocking and throws {@link GatewayException} when the bridge rejects
 * it or cannot be reached.
 */
public interface GatewayPort {

    void deleteMessage(String channelId, String messageId);

    /**
     * Delete several messages of one channel in a single call.
     */
    void deleteMessages(String channelId, List<String> messageIds);

    void addRole(String userId, String roleId, String reason);

    void removeRole(String userId, String roleId, String reason);

    void ban(String userId, String reason);

    void unban(String userId, String reason);

    void kick(String userId, String reason);

    /**
     * Change a member's nickname; {@code null} restores their own name.
     */
    void setNickname(String userId, String nickname, String reason);

    /**
     * Send a private message to a user.
     */
    void sendDirectMessage(String userId, String content);

    /**
     * Post a message to a channel as the bot.
     */
    void sendMessage(String channelId, String content);

    /**
     * Post a message to a channel under another display name, used to
     * impersonate the relayed author in the watch channel.
     */
    void sendAs(String channelId, String username, String avatarUrl, String content);
}
