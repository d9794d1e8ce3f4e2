package me.golemcore.modbot.adapter.outbound.site;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Wire form of an infraction record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SiteInfraction {

    private Long id;
    private String type;
    private String user;
    private String actor;
    private String reason;

    @JsonProperty("inserted_at")
    private Instant insertedAt;

    @JsonProperty("expires_at")
    private Instant expiresAt;

    private Boolean active;
    private Boolean hidden;

    @JsonProperty("dm_sent")
    private Boolean dmSent;
}
