package me.golemcore.modbot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.modbot.adapter.inbound.web.dto.ApplyInfractionRequest;
import me.golemcore.modbot.adapter.inbound.web.dto.InfractionResponse;
import me.golemcore.modbot.adapter.inbound.web.dto.PardonRequest;
import me.golemcore.modbot.adapter.inbound.webhook.ApiTokenAuthenticator;
import me.golemcore.modbot.domain.model.InfractionRequest;
import me.golemcore.modbot.domain.model.InfractionResult;
import me.golemcore.modbot.domain.model.InfractionType;
import me.golemcore.modbot.domain.service.InfractionService;
import me.golemcore.modbot.util.DurationParser;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Moderator API for infractions.
 *
 * <ul>
 * <li>{@code POST /api/infractions} - apply; 201, 409 on conflict, 502 when
 * the sanction could not be applied</li>
 * <li>{@code POST /api/infractions/pardon} - lift early; 200 or 404</li>
 * <li>{@code POST /api/infractions/reschedule} - re-arm expiry timers from the
 * site API</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/infractions")
@RequiredArgsConstructor
@Slf4j
public class InfractionController {

    private final InfractionService infractionService;
    private final ApiTokenAuthenticator authenticator;

    @PostMapping
    public Mono<ResponseEntity<InfractionResponse>> apply(
            @RequestBody ApplyInfractionRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            requireAuthenticated(headers);
            if (request.getActorId() == null || request.getActorId().isBlank()) {
                throw new IllegalArgumentException("'actorId' is required");
            }

            InfractionRequest infractionRequest = InfractionRequest.builder()
                    .type(InfractionType.fromApiName(request.getType()))
                    .userId(request.getUserId())
                    .actorId(request.getActorId())
                    .reason(request.getReason())
                    .duration(request.getDuration() != null && !request.getDuration().isBlank()
                            ? DurationParser.parse(request.getDuration())
                            : null)
                    .hidden(request.isHidden())
                    .build();

            InfractionResult result = infractionService.apply(infractionRequest);
            HttpStatus status = switch (result.getStatus()) {
            case APPLIED -> HttpStatus.CREATED;
            case CONFLICT -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_GATEWAY;
            };
            log.info("[API] Apply {} to {}: {}", request.getType(), request.getUserId(), result.getStatus());
            return ResponseEntity.status(status).body(InfractionResponse.from(result));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/pardon")
    public Mono<ResponseEntity<InfractionResponse>> pardon(
            @RequestBody PardonRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            requireAuthenticated(headers);
            if (request.getUserId() == null || request.getUserId().isBlank()) {
                throw new IllegalArgumentException("'userId' is required");
            }

            InfractionResult result = infractionService.pardon(InfractionType.fromApiName(request.getType()),
                    request.getUserId(), request.getActorId());
            HttpStatus status = result.getStatus() == InfractionResult.Status.NOT_FOUND
                    ? HttpStatus.NOT_FOUND
                    : HttpStatus.OK;
            return ResponseEntity.status(status).body(InfractionResponse.from(result));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/reschedule")
    public Mono<ResponseEntity<InfractionResponse>> reschedule(@RequestHeader HttpHeaders headers) {
        return Mono.fromCallable(() -> {
            requireAuthenticated(headers);
            int scheduled = infractionService.rescheduleInfractions();
            return ResponseEntity.ok(InfractionResponse.rescheduled(scheduled));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void requireAuthenticated(HttpHeaders headers) {
        if (!authenticator.authenticate(headers)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Unauthorized");
        }
    }
}
