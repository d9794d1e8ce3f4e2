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

import lombok.Builder;
import lombok.Data;

/**
 * Result of an infraction operation.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code status} - what happened</li>
 * <li>{@code infraction} - the record applied, found or conflicting</li>
 * <li>{@code message} - text shown to the moderator</li>
 * </ul>
 *
 * <p>
 * A conflict is a normal outcome, not an exception: the caller decides how to
 * present it.
 *
 * @since 1.0
 */
@Data
@Builder
public class InfractionResult {

    private Status status;
    private Infraction infraction;
    private String message;

    public enum Status {
        APPLIED, CONFLICT, FAILED, PARDONED, NOT_FOUND
    }

    public static InfractionResult applied(Infraction infraction) {
        return InfractionResult.builder()
                .status(Status.APPLIED)
                .infraction(infraction)
                .message("Applied " + infraction.getType().apiName() + " to user " + infraction.getUserId()
                        + " (infraction #" + infraction.getId() + ")")
                .build();
    }

    public static InfractionResult conflict(Infraction existing) {
        return InfractionResult.builder()
                .status(Status.CONFLICT)
                .infraction(existing)
                .message("User " + existing.getUserId() + " already has an active "
                        + existing.getType().apiName() + " infraction. See infraction #" + existing.getId() + ".")
                .build();
    }

    public static InfractionResult failed(String message) {
        return InfractionResult.builder()
                .status(Status.FAILED)
                .message(message)
                .build();
    }

    public static InfractionResult pardoned(Infraction infraction, String message) {
        return InfractionResult.builder()
                .status(Status.PARDONED)
                .infraction(infraction)
                .message(message)
                .build();
    }

    public static InfractionResult notFound(InfractionType type, String userId) {
        return InfractionResult.builder()
                .status(Status.NOT_FOUND)
                .message("There's no active " + type.apiName() + " infraction for user " + userId + ".")
                .build();
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
