package me.golemcore.modbot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix. This class
 * contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * <li>{@link SiteProperties} - site API holding infraction records</li>
 * <li>{@link GatewayProperties} - chat gateway bridge</li>
 * <li>{@link ModerationProperties} - roles and staff channels</li>
 * <li>{@link AntiSpamProperties} - rule thresholds and whitelists</li>
 * <li>{@link WatchProperties} - watch channel relay</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding. Values are read once at startup.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private HttpProperties http = new HttpProperties();
    private SiteProperties site = new SiteProperties();
    private GatewayProperties gateway = new GatewayProperties();
    private EventsProperties events = new EventsProperties();
    private ModerationProperties moderation = new ModerationProperties();
    private AntiSpamProperties antispam = new AntiSpamProperties();
    private WatchProperties watch = new WatchProperties();

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class SiteProperties {
        private String baseUrl = "http://localhost:8000/api";
        private String token = "";
        private String logsViewUrl = "http://localhost:8000/staff/bot/logs/";
    }

    @Data
    public static class GatewayProperties {
        private String baseUrl = "http://localhost:8090";
        private String token = "";
        private String botUserId = "";
    }

    @Data
    public static class EventsProperties {
        private String token = "";
    }

    @Data
    public static class ModerationProperties {
        private String modLogChannelId = "";
        private String modAlertsChannelId = "";
        private String mutedRoleId = "";
        private String moderatorsRoleId = "";
        private String superstarNickname = "Superstar";
        private Duration reapplyThreshold = Duration.ofSeconds(60);
        private String appealFooter = "If you would like to discuss or appeal this infraction, "
                + "send a message to the moderation team.";
    }

    // ==================== ANTI-SPAM ====================

    @Data
    public static class AntiSpamProperties {
        private boolean enabled = true;
        private int cacheSize = 1000;
        private boolean cleanOffending = true;
        private boolean pingEveryone = true;
        private Duration alertDelay = Duration.ofSeconds(6);
        private PunishmentProperties punishment = new PunishmentProperties();
        private List<String> channelWhitelist = new ArrayList<>();
        private List<String> roleWhitelist = new ArrayList<>();
        private Map<String, RuleProperties> rules = new LinkedHashMap<>();
    }

    @Data
    public static class PunishmentProperties {
        private Duration removeAfter = Duration.ofMinutes(10);
    }

    @Data
    public static class RuleProperties {
        private Integer interval;
        private Integer max;
        private Map<String, Integer> extras = new LinkedHashMap<>();
    }

    // ==================== WATCH CHANNEL ====================

    @Data
    public static class WatchProperties {
        private boolean enabled = true;
        private String channelId = "";
        private Duration logDelay = Duration.ofSeconds(2);
        private int headerMessageLimit = 15;
    }
}
