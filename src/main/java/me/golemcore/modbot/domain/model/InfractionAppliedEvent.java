package me.golemcore.modbot.domain.model;

/**
 * Event published after an infraction has been recorded and its effect applied.
 * Consumed by the watch relay to start relaying a newly watched user.
 *
 * @since 1.0
 */
public record InfractionAppliedEvent(Infraction infraction) {
}
