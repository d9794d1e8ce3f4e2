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

import java.time.Duration;
import java.util.Map;

/**
 * Thresholds for one anti-spam rule: the lookback {@code interval}, the
 * {@code max} count tolerated within it, and rule-specific extras such as
 * {@code max_consecutive} for newlines.
 *
 * @since 1.0
 */
public record RuleConfig(Duration interval, int max, Map<String, Integer> extras) {

    public RuleConfig {
        extras = extras != null ? Map.copyOf(extras) : Map.of();
    }

    public static RuleConfig of(int intervalSeconds, int max) {
        return new RuleConfig(Duration.ofSeconds(intervalSeconds), max, Map.of());
    }

    public static RuleConfig of(int intervalSeconds, int max, Map<String, Integer> extras) {
        return new RuleConfig(Duration.ofSeconds(intervalSeconds), max, extras);
    }

    public int extra(String name, int defaultValue) {
        return extras.getOrDefault(name, defaultValue);
    }
}
