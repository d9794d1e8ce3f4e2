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
 * One post to a staff channel.
 */
@Data
@Builder
public class ModLogEntry {

    private Target target;
    private String title;
    private String text;
    private String footer;
    private boolean pingEveryone;
    private boolean pingModerators;

    public enum Target {
        MOD_LOG, MOD_ALERTS
    }

    public static ModLogEntry log(String title, String text) {
        return ModLogEntry.builder()
                .target(Target.MOD_LOG)
                .title(title)
                .text(text)
                .build();
    }
}
