package me.golemcore.modbot.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.modbot.domain.model.Infraction;
import me.golemcore.modbot.domain.model.InfractionType;
import me.golemcore.modbot.infrastructure.config.BotProperties;
import me.golemcore.modbot.port.outbound.GatewayException;
import me.golemcore.modbot.port.outbound.GatewayPort;
import me.golemcore.modbot.util.DurationParser;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Best-effort private messages telling a user about sanctions against them.
 * Users with closed DMs are common, so failures are logged and reported as
 * {@code false}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InfractionNotifier {

    private static final Set<InfractionType> SILENT_TYPES = Set.of(InfractionType.NOTE, InfractionType.WATCH);

    private final GatewayPort gateway;
    private final BotProperties properties;

    public boolean shouldNotify(Infraction infraction) {
        return !infraction.isHidden() && !SILENT_TYPES.contains(infraction.getType());
    }

    /**
     * Tell the user an infraction was applied.
     *
     * @return whether the message was delivered
     */
    public boolean notifyApplied(Infraction infraction) {
        StringBuilder text = new StringBuilder();
        text.append("**Infraction information**\n");
        text.append("**Type:** ").append(capitalize(infraction.getType())).append('\n');
        if (infraction.getExpiresAt() != null && infraction.getInsertedAt() != null) {
            Duration duration = Duration.between(infraction.getInsertedAt(), infraction.getExpiresAt());
            text.append("**Duration:** ").append(DurationParser.format(duration)).append('\n');
            text.append("**Expires:** ").append(infraction.getExpiresAt()).append('\n');
        }
        text.append("**Reason:** ").append(infraction.getReason() != null ? infraction.getReason() : "N/A");
        if (infraction.getType() != InfractionType.WARNING) {
            text.append("\n\n").append(properties.getModeration().getAppealFooter());
        }
        return send(infraction, text.toString());
    }

    /**
     * Tell the user a sanction was lifted.
     */
    public boolean notifyPardoned(Infraction infraction) {
        String text = "**You have been un" + infraction.getType().getPastTense() + "**\n"
                + "Your " + infraction.getType().apiName() + " has expired or been lifted.";
        return send(infraction, text);
    }

    private boolean send(Infraction infraction, String text) {
        try {
            gateway.sendDirectMessage(infraction.getUserId(), text);
            return true;
        } catch (GatewayException e) {
            log.info("[Infractions] Could not DM user {} about infraction #{}: {}",
                    infraction.getUserId(), infraction.getId(), e.getMessage());
            return false;
        }
    }

    private static String capitalize(InfractionType type) {
        String name = type.apiName();
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }
}
