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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of moderation sanction.
 *
 * <ul>
 * <li>Exclusive types allow at most one active record per user.</li>
 * <li>Instant types take effect once and are stored inactive.</li>
 * </ul>
 */
public enum InfractionType {

    MUTE(true, false, "muted"),
    BAN(true, false, "banned"),
    SUPERSTAR(true, false, "superstarified"),
    WATCH(true, false, "watched"),
    KICK(false, true, "kicked"),
    WARNING(false, true, "warned"),
    NOTE(false, true, "noted");

    private final boolean exclusive;
    private final boolean instant;
    private final String pastTense;

    InfractionType(boolean exclusive, boolean instant, String pastTense) {
        this.exclusive = exclusive;
        this.instant = instant;
        this.pastTense = pastTense;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public boolean isInstant() {
        return instant;
    }

    public String getPastTense() {
        return pastTense;
    }

    @JsonValue
    public String apiName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InfractionType fromApiName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Infraction type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown infraction type: " + value, e);
        }
    }
}
