package me.golemcore.modbot.util;

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
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses moderator duration strings such as {@code 30m}, {@code 7d} or
 * {@code 1h30m} and renders durations back in the same notation.
 *
 * <p>
 * Supported units: {@code s}, {@code m}, {@code h}, {@code d}, {@code w}.
 */
public final class DurationParser {

    private static final Pattern DURATION_PATTERN = Pattern.compile("^(\\d+[smhdw])+$");
    private static final Pattern PART_PATTERN = Pattern.compile("(\\d+)([smhdw])");

    private static final long MINUTE = 60;
    private static final long HOUR = 3600;
    private static final long DAY = 86400;
    private static final long WEEK = 604800;

    private DurationParser() {
    }

    /**
     * Parse a duration string.
     *
     * @throws IllegalArgumentException
     *             when the string is blank, malformed or zero
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        if (!DURATION_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid duration: " + value);
        }

        long seconds = 0;
        Matcher matcher = PART_PATTERN.matcher(normalized);
        while (matcher.find()) {
            long amount = Long.parseLong(matcher.group(1));
            seconds += switch (matcher.group(2)) {
            case "s" -> amount;
            case "m" -> amount * MINUTE;
            case "h" -> amount * HOUR;
            case "d" -> amount * DAY;
            case "w" -> amount * WEEK;
            default -> throw new IllegalArgumentException("Invalid duration unit in: " + value);
            };
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException("Duration must be positive: " + value);
        }
        return Duration.ofSeconds(seconds);
    }

    /**
     * Format a duration like {@code 2d 3h 15m}. Sub-second parts are dropped.
     */
    public static String format(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds <= 0) {
            return "0s";
        }

        long weeks = seconds / WEEK;
        seconds %= WEEK;
        long days = seconds / DAY;
        seconds %= DAY;
        long hours = seconds / HOUR;
        seconds %= HOUR;
        long minutes = seconds / MINUTE;
        seconds %= MINUTE;

        StringBuilder sb = new StringBuilder();
        appendPart(sb, weeks, "w");
        appendPart(sb, days, "d");
        appendPart(sb, hours, "h");
        appendPart(sb, minutes, "m");
        appendPart(sb, seconds, "s");
        return sb.toString().trim();
    }

    private static void appendPart(StringBuilder sb, long amount, String unit) {
        if (amount > 0) {
            sb.append(amount).append(unit).append(' ');
        }
    }
}
