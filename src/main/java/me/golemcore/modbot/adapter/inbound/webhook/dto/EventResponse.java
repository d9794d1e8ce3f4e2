package me.golemcore.modbot.adapter.inbound.webhook.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response for gateway event endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventResponse {

    private String status;
    private String error;

    public static EventResponse accepted() {
        return EventResponse.builder().status("accepted").build();
    }

    public static EventResponse error(String message) {
        return EventResponse.builder().status("error").error(message).build();
    }
}
