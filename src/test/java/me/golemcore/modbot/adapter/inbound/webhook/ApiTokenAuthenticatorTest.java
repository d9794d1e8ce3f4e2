package me.golemcore.modbot.adapter.inbound.webhook;

import me.golemcore.modbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.*;

class ApiTokenAuthenticatorTest {

    private static final String TOKEN = "events-secret";

    private BotProperties properties;
    private ApiTokenAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getEvents().setToken(TOKEN);
        authenticator = new ApiTokenAuthenticator(properties);
    }

    @Test
    void shouldAcceptBearerToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(TOKEN);

        assertTrue(authenticator.authenticate(headers));
    }

    @Test
    void shouldAcceptCustomHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Modbot-Token", TOKEN);

        assertTrue(authenticator.authenticate(headers));
    }

    @Test
    void shouldRejectWrongToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("wrong");

        assertFalse(authenticator.authenticate(headers));
    }

    @Test
    void shouldRejectMissingHeaders() {
        assertFalse(authenticator.authenticate(new HttpHeaders()));
    }

    @Test
    void shouldRejectEverythingWhenNoTokenConfigured() {
        properties.getEvents().setToken("");
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("");

        assertFalse(authenticator.authenticate(headers));
    }
}
