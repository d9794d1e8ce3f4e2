package me.golemcore.modbot.adapter.outbound.site;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Deleted-message log document. Sent without {@code id}; the site answers with
 * the stored copy carrying it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeletedMessageLog {

    private Long id;
    private String actor;
    private Instant creation;

    @JsonProperty("deletedmessage_set")
    @Builder.Default
    private List<DeletedMessage> messages = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DeletedMessage {
        private String id;
        private String author;

        @JsonProperty("channel_id")
        private String channelId;

        private String content;
        private List<String> attachments;
    }
}
