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
 * Failure reported by the chat gateway bridge.
 */
public class GatewayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final int NOT_FOUND = 404;
    private static final int FORBIDDEN = 403;

    private final int status;

    public GatewayException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public GatewayException(int status, String message) {
        this(status, message, null);
    }

    public int getStatus() {
        return status;
    }

    public boolean isNotFound() {
        return status == NOT_FOUND;
    }

    public boolean isForbidden() {
        return status == FORBIDDEN;
    }
}
