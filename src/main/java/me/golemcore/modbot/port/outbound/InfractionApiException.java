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

/**
 * Failure talking to the infraction persistence API. {@code status} is the
 * HTTP status, or {@code -1} when no response was received.
 */
public class InfractionApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public InfractionApiException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public InfractionApiException(int status, String message) {
        this(status, message, null);
    }

    public int getStatus() {
        return status;
    }
}
