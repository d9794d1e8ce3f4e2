package me.golemcore.modbot.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A chat message as delivered by the gateway bridge. Owned by the gateway; the
 * moderation core only reads it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private String id;
    private String channelId;
    private String authorId;
    private String authorName;
    private boolean authorBot;
    private Instant timestamp;

    @Builder.Default
    private String content = "";

    @Builder.Default
    private List<String> authorRoleIds = new ArrayList<>();

    @Builder.Default
    private List<String> attachments = new ArrayList<>(); // attachment URLs

    @Builder.Default
    private List<Mention> mentions = new ArrayList<>();

    @Builder.Default
    private List<String> roleMentions = new ArrayList<>();

    @Builder.Default
    private List<String> embedUrls = new ArrayList<>();

    private String replyToAuthorId; // author of the referenced message, if any

    /**
     * A user mentioned in the message.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Mention {
        private String userId;
        private boolean bot;
    }
}
