package me.golemcore.modbot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.modbot.domain.model.Infraction;
import me.golemcore.modbot.domain.model.InfractionResult;

/**
 * Outcome of an infraction operation as returned to moderators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InfractionResponse {

    private String status;
    private String message;
    private Infraction infraction;
    private Integer scheduled;

    public static InfractionResponse from(InfractionResult result) {
        return InfractionResponse.builder()
                .status(result.getStatus().name().toLowerCase())
                .message(result.getMessage())
                .infraction(result.getInfraction())
                .build();
    }

    public static InfractionResponse rescheduled(int scheduled) {
        return InfractionResponse.builder()
                .status("rescheduled")
                .message("Rescheduled " + scheduled + " infractions")
                .scheduled(scheduled)
                .build();
    }
}
