package me.golemcore.modbot.adapter.inbound.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.modbot.adapter.inbound.webhook.dto.EventResponse;
import me.golemcore.modbot.adapter.inbound.webhook.dto.MessageEventPayload;
import me.golemcore.modbot.domain.model.ChatMessage;
import me.golemcore.modbot.domain.service.AntiSpamService;
import me.golemcore.modbot.domain.service.InfractionService;
import me.golemcore.modbot.watch.WatchChannelRelay;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Inbound events pushed by the chat gateway bridge (WebFlux).
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>{@code POST /api/events/messages} - new message: anti-spam check, then
 * watch relay</li>
 * <li>{@code POST /api/events/messages/edit} - edited message</li>
 * <li>{@code POST /api/events/members/{userId}/join} - member (re)joined</li>
 * </ul>
 *
 * <p>
 * Processing calls blocking ports, so it runs on the bounded-elastic
 * scheduler. All endpoints answer {@code 202 Accepted} once the event has been
 * handled.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class GatewayEventController {

    private final ApiTokenAuthenticator authenticator;
    private final AntiSpamService antiSpamService;
    private final WatchChannelRelay watchChannelRelay;
    private final InfractionService infractionService;

    @PostMapping("/messages")
    public Mono<ResponseEntity<EventResponse>> onMessage(
            @RequestBody MessageEventPayload payload,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!authenticator.authenticate(headers)) {
                return unauthorized();
            }
            String error = validate(payload);
            if (error != null) {
                return badRequest(error);
            }

            ChatMessage message = payload.toChatMessage();
            antiSpamService.onMessage(message);
            watchChannelRelay.onMessage(message);
            return accepted();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/messages/edit")
    public Mono<ResponseEntity<EventResponse>> onMessageEdit(
            @RequestBody MessageEventPayload payload,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!authenticator.authenticate(headers)) {
                return unauthorized();
            }
            String error = validate(payload);
            if (error != null) {
                return badRequest(error);
            }

            antiSpamService.onMessageEdit(payload.toChatMessage());
            return accepted();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/members/{userId}/join")
    public Mono<ResponseEntity<EventResponse>> onMemberJoin(
            @PathVariable String userId,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!authenticator.authenticate(headers)) {
                return unauthorized();
            }
            infractionService.onMemberJoin(userId);
            log.debug("[Events] Member join handled for {}", userId);
            return accepted();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private String validate(MessageEventPayload payload) {
        if (payload.getId() == null || payload.getId().isBlank()) {
            return "'id' is required";
        }
        if (payload.getChannelId() == null || payload.getChannelId().isBlank()) {
            return "'channelId' is required";
        }
        if (payload.getAuthorId() == null || payload.getAuthorId().isBlank()) {
            return "'authorId' is required";
        }
        if (payload.getTimestamp() == null) {
            return "'timestamp' is required";
        }
        return null;
    }

    private ResponseEntity<EventResponse> accepted() {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(EventResponse.accepted());
    }

    private ResponseEntity<EventResponse> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(EventResponse.error("Unauthorized"));
    }

    private ResponseEntity<EventResponse> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(EventResponse.error(message));
    }
}
