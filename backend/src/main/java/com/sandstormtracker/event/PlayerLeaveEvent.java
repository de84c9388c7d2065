package com.sandstormtracker.event;

import java.time.LocalDateTime;

public record PlayerLeaveEvent(LocalDateTime timestamp, String name) implements GameEvent {

    @Override
    public EventType type() {
        return EventType.PLAYER_LEAVE;
    }
}
