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

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key/value lines describing a deactivation, posted to the mod log. Failures
 * are collected under {@code Failure} rather than thrown.
 */
@Getter
public class DeactivationSummary {

    private final Infraction infraction;
    private final Map<String, String> lines = new LinkedHashMap<>();
    private boolean failed;
    private boolean alreadyInactive;

    public DeactivationSummary(Infraction infraction) {
        this.infraction = infraction;
    }

    public static DeactivationSummary alreadyInactive(Infraction infraction) {
        DeactivationSummary summary = new DeactivationSummary(infraction);
        summary.alreadyInactive = true;
        summary.put("Status", "Already inactive");
        return summary;
    }

    public void put(String key, String value) {
        lines.put(key, value);
    }

    public void addFailure(String text) {
        failed = true;
        lines.merge("Failure", text, (existing, added) -> existing + "; " + added);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        lines.forEach((key, value) -> sb.append(key).append(": ").append(value).append('\n'));
        return sb.toString().trim();
    }
}
