package com.sandstormtracker.event;

import java.time.LocalDateTime;

public record PlayerJoinEvent(LocalDateTime timestamp, String name, Integer team) implements GameEvent {

    @Override
    public EventType type() {
        return EventType.PLAYER_JOIN;
    }
}
