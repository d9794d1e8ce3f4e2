package me.golemcore.modbot.adapter.inbound.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.modbot.infrastructure.config.BotProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authenticates requests from the gateway bridge and moderator tooling using
 * the shared {@code bot.events.token}.
 *
 * <p>
 * The token is accepted as {@code Authorization: Bearer <token>} or in the
 * {@code X-Modbot-Token} header. Comparisons are constant-time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiTokenAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String CUSTOM_HEADER = "X-Modbot-Token";

    private final BotProperties properties;

    /**
     * @return {@code true} if the request carries the configured token
     */
    public boolean authenticate(HttpHeaders headers) {
        String expected = properties.getEvents().getToken();
        if (expected == null || expected.isBlank()) {
            log.warn("[Events] No token configured, rejecting request");
            return false;
        }

        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return constantTimeEquals(expected, authHeader.substring(BEARER_PREFIX.length()));
        }

        String customToken = headers.getFirst(CUSTOM_HEADER);
        if (customToken != null) {
            return constantTimeEquals(expected, customToken);
        }

        log.debug("[Events] No authentication token found in request headers");
        return false;
    }

    private boolean constantTimeEquals(String expected, String provided) {
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] providedBytes = provided.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expectedBytes, providedBytes);
    }
}
