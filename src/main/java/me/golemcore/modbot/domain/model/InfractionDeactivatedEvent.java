package me.golemcore.modbot.domain.model;

/**
 * Event published after an infraction has been marked inactive, whether it
 * expired or was pardoned.
 *
 * @since 1.0
 */
public record InfractionDeactivatedEvent(Infraction infraction, boolean pardoned) {
}
