package me.golemcore.modbot.adapter.outbound.site;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.modbot.domain.model.Infraction;
import me.golemcore.modbot.domain.model.InfractionType;
import me.golemcore.modbot.infrastructure.config.AutoConfiguration;
import me.golemcore.modbot.infrastructure.http.FeignClientFactory;
import me.golemcore.modbot.port.outbound.InfractionApiException;
import me.golemcore.modbot.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SiteInfractionAdapterTest {

    private static final String INFRACTION_JSON = """
            {"id": 42, "type": "mute", "user": "u1", "actor": "mod-1", "reason": "spam",
             "inserted_at": "2026-02-11T10:00:00Z", "expires_at": "2026-02-11T10:10:00Z",
             "active": true, "hidden": false, "dm_sent": true, "unknown_field": 1}
            """;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private OkHttpMockEngine engine;
    private SiteInfractionAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        FeignClientFactory factory = new FeignClientFactory(engine.client(), objectMapper);
        SiteApi api = factory.createAuthorized(SiteApi.class, "http://site.test/api", "Token site-secret");
        adapter = new SiteInfractionAdapter(api);
    }

    @Test
    void shouldListInfractionsWithFilters() {
        engine.enqueueJson(200, "[" + INFRACTION_JSON + "]");

        List<Infraction> infractions = adapter.listInfractions(true, InfractionType.MUTE, "u1");

        assertEquals(1, infractions.size());
        Infraction infraction = infractions.get(0);
        assertEquals(42, infraction.getId());
        assertEquals(InfractionType.MUTE, infraction.getType());
        assertEquals(Instant.parse("2026-02-11T10:10:00Z"), infraction.getExpiresAt());
        assertTrue(infraction.isActive());
        assertTrue(infraction.isDmSent());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("GET", request.method());
        assertTrue(request.target().startsWith("/api/bot/infractions?"));
        assertTrue(request.target().contains("active=true"));
        assertTrue(request.target().contains("type=mute"));
        assertTrue(request.target().contains("user__id=u1"));
        assertEquals("Token site-secret", request.header("Authorization"));
    }

    @Test
    void shouldOmitNullFilters() {
        engine.enqueueJson(200, "[]");

        assertTrue(adapter.listInfractions(true, null, null).isEmpty());

        assertEquals("/api/bot/infractions?active=true", engine.takeRequest().target());
    }

    @Test
    void shouldSkipRecordsWithUnknownType() {
        String unknown = INFRACTION_JSON.replace("\"id\": 42", "\"id\": 43").replace("\"mute\"", "\"voice_ban\"");
        engine.enqueueJson(200, "[" + INFRACTION_JSON + "," + unknown + "]");

        List<Infraction> infractions = adapter.listInfractions(true, null, null);

        assertEquals(1, infractions.size());
        assertEquals(42, infractions.get(0).getId());
    }

    @Test
    void shouldRejectSingleRecordWithUnknownType() {
        engine.enqueueJson(200, INFRACTION_JSON.replace("\"mute\"", "\"voice_ban\""));

        assertThrows(InfractionApiException.class, () -> adapter.getInfraction(42));
    }

    @Test
    void shouldCreateInfractionWithSnakeCaseBody() throws IOException {
        engine.enqueueJson(201, INFRACTION_JSON);
        Infraction draft = Infraction.builder()
                .type(InfractionType.MUTE)
                .userId("u1")
                .actorId("mod-1")
                .reason("spam")
                .expiresAt(Instant.parse("2026-02-11T10:10:00Z"))
                .active(true)
                .build();

        Infraction created = adapter.createInfraction(draft);

        assertEquals(42, created.getId());
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("mute", body.get("type").asText());
        assertEquals("u1", body.get("user").asText());
        assertEquals("2026-02-11T10:10:00Z", body.get("expires_at").asText());
        assertFalse(body.has("id"));
    }

    @Test
    void shouldDeactivateWithPatch() throws IOException {
        engine.enqueueJson(200, INFRACTION_JSON.replace("\"active\": true", "\"active\": false"));

        Infraction updated = adapter.deactivateInfraction(42);

        assertFalse(updated.isActive());
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("PATCH", request.method());
        assertEquals("/api/bot/infractions/42", request.target());
        assertFalse(objectMapper.readTree(request.body()).get("active").asBoolean());
    }

    @Test
    void shouldMapHttpErrorToApiException() {
        engine.enqueueJson(404, "{\"detail\": \"Not found.\"}");

        InfractionApiException error = assertThrows(InfractionApiException.class, () -> adapter.getInfraction(7));

        assertEquals(404, error.getStatus());
    }

    @Test
    void shouldMapTransportFailureToApiException() {
        engine.enqueueFailure(new ConnectException("refused"));

        InfractionApiException error = assertThrows(InfractionApiException.class, () -> adapter.deleteInfraction(7));

        assertEquals(-1, error.getStatus());
    }
}
