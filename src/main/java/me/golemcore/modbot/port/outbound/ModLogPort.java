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

import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.model.ModLogEntry;

import java.util.Collection;
import java.util.Optional;

/**
 * Port for the staff-facing log sink.
 *
 * <p>
 * Posting is fire-and-forget: implementations log failures locally and never
 * throw, so a broken log channel cannot abort a moderation action.
 */
public interface ModLogPort {

    /**
     * Post an entry to the mod-log or mod-alerts channel.
     */
    void send(ModLogEntry entry);

    /**
     * Upload deleted messages as one log document.
     *
     * @return the URL staff can open, empty when the upload failed
     */
    Optional<String> uploadLog(Collection<ChatMessage> messages, String actorId);
}
