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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A moderation sanction as stored by the site API, the source of truth for
 * infraction state. Records are deactivated, never deleted, except when the
 * sanction could not be applied right after creation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Infraction {

    private long id;
    private InfractionType type;
    private String userId;
    private String actorId;
    private String reason;
    private Instant insertedAt;
    private Instant expiresAt;
    private boolean active;
    private boolean hidden;
    private boolean dmSent;

    @JsonIgnore
    public boolean isExpirable() {
        return active && expiresAt != null;
    }

    @JsonIgnore
    public String getTaskId() {
        return "infraction-expiry:" + id;
    }
}
