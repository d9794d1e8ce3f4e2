package me.golemcore.modbot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the moderation bot core.
 *
 * <p>
 * The bot watches chat traffic delivered by a gateway bridge, detects spam with
 * a battery of sliding-window rules, and manages the lifecycle of moderation
 * infractions against the site API.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Anti-spam</b> - ten threshold rules over a per-channel message
 * window, aggregated into one punishment and one mod alert per pass</li>
 * <li><b>Infractions</b> - apply, expire, pardon and re-arm temporary
 * sanctions across restarts</li>
 * <li><b>Watch channel</b> - relay messages of watched users to a staff
 * channel, grouped by author and channel</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → GatewayEventController, InfractionController
 * Domain Layer       → AntiSpamService, InfractionService, WatchChannelRelay
 * Infrastructure     → Site API / Gateway bridge Feign adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ModBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModBotApplication.class, args);
    }

}
