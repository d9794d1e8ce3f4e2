package me.golemcore.modbot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for {@code POST /api/infractions/pardon}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PardonRequest {
    private String type;
    private String userId;
    private String actorId;
}
