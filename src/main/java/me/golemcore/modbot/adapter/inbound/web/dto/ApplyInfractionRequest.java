package me.golemcore.modbot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for {@code POST /api/infractions}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplyInfractionRequest {

    /** Infraction type, e.g. "mute" or "ban". Required. */
    private String type;

    /** Target user id. Required. */
    private String userId;

    /** Moderator applying the sanction. Required. */
    private String actorId;

    private String reason;

    /** Optional duration such as "1h" or "7d"; omit for a permanent sanction. */
    private String duration;

    private boolean hidden;
}
