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

import me.golemcore.modbot.domain.model.Infraction;
import me.golemcore.modbot.domain.model.InfractionType;

import java.util.List;

/**
 * Port for the persistence API that owns infraction records. The API is the
 * only source of truth: in-memory schedule state is always re-derived from it.
 *
 * <p>
 * All methods are blocking and throw {@link InfractionApiException} on
 * transport or HTTP failure.
 */
public interface InfractionApiPort {

    /**
     * List infractions matching the given filters.
     *
     * @param active
     *            {@code null} for any state
     * @param type
     *            {@code null} for any type
     * @param userId
     *            {@code null} for any user
     */
    List<Infraction> listInfractions(Boolean active, InfractionType type, String userId);

    /**
     * Fetch one infraction by id.
     */
    Infraction getInfraction(long id);

    /**
     * Persist a new infraction; the returned copy carries the assigned id.
     */
    Infraction createInfraction(Infraction draft);

    /**
     * Mark an infraction inactive.
     */
    Infraction deactivateInfraction(long id);

    /**
     * Remove an infraction whose effect could not be applied.
     */
    void deleteInfraction(long id);
}
