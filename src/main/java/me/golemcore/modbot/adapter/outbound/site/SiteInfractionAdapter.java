package me.golemcore.modbot.adapter.outbound.site;

import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.modbot.domain.model.Infraction;
import me.golemcore.modbot.domain.model.InfractionType;
import me.golemcore.modbot.port.outbound.InfractionApiException;
import me.golemcore.modbot.port.outbound.InfractionApiPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link InfractionApiPort} backed by the site's {@code bot/infractions}
 * endpoints. Feign failures surface as {@link InfractionApiException} carrying
 * the HTTP status.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SiteInfractionAdapter implements InfractionApiPort {

    private final SiteApi siteApi;

    @Override
    public List<Infraction> listInfractions(Boolean active, InfractionType type, String userId) {
        Map<String, Object> filters = new LinkedHashMap<>();
        if (active != null) {
            filters.put("active", active);
        }
        if (type != null) {
            filters.put("type", type.apiName());
        }
        if (userId != null) {
            filters.put("user__id", userId);
        }
        List<SiteInfraction> records = call("list infractions", () -> siteApi.listInfractions(filters));
        if (records == null) {
            return List.of();
        }
        List<Infraction> infractions = new ArrayList<>(records.size());
        for (SiteInfraction record : records) {
            try {
                infractions.add(toDomain(record));
            } catch (InfractionApiException e) {
                log.warn("[Site] Skipping infraction #{}: {}", record != null ? record.getId() : null,
                        e.getMessage());
            }
        }
        return infractions;
    }

    @Override
    public Infraction getInfraction(long id) {
        return toDomain(call("get infraction #" + id, () -> siteApi.getInfraction(id)));
    }

    @Override
    public Infraction createInfraction(Infraction draft) {
        SiteInfraction body = SiteInfraction.builder()
                .type(draft.getType().apiName())
                .user(draft.getUserId())
                .actor(draft.getActorId())
                .reason(draft.getReason())
                .expiresAt(draft.getExpiresAt())
                .active(draft.isActive())
                .hidden(draft.isHidden())
                .build();
        Infraction created = toDomain(call("create infraction", () -> siteApi.createInfraction(body)));
        log.debug("[Site] Created {} infraction #{} for {}", draft.getType().apiName(), created.getId(),
                draft.getUserId());
        return created;
    }

    @Override
    public Infraction deactivateInfraction(long id) {
        return toDomain(call("deactivate infraction #" + id,
                () -> siteApi.updateInfraction(id, Map.of("active", false))));
    }

    @Override
    public void deleteInfraction(long id) {
        call("delete infraction #" + id, () -> {
            siteApi.deleteInfraction(id);
            return null;
        });
    }

    private <T> T call(String action, Supplier<T> request) {
        try {
            return request.get();
        } catch (FeignException e) {
            log.warn("[Site] Failed to {} (status {}): {}", action, e.status(), e.getMessage());
            throw new InfractionApiException(e.status(), "Failed to " + action + ": " + e.getMessage(), e);
        }
    }

    static Infraction toDomain(SiteInfraction record) {
        if (record == null) {
            throw new InfractionApiException(-1, "Site API returned an empty infraction");
        }
        InfractionType type;
        try {
            type = InfractionType.fromApiName(record.getType());
        } catch (IllegalArgumentException e) {
            throw new InfractionApiException(-1, "Unusable site record: " + e.getMessage(), e);
        }
        return Infraction.builder()
                .id(record.getId() != null ? record.getId() : 0L)
                .type(type)
                .userId(record.getUser())
                .actorId(record.getActor())
                .reason(record.getReason())
                .insertedAt(record.getInsertedAt())
                .expiresAt(record.getExpiresAt())
                .active(Boolean.TRUE.equals(record.getActive()))
                .hidden(Boolean.TRUE.equals(record.getHidden()))
                .dmSent(Boolean.TRUE.equals(record.getDmSent()))
                .build();
    }
}
