package com.sandstormtracker.event;

import java.time.LocalDateTime;

public record PlayerDisconnectEvent(LocalDateTime timestamp, String platformId) implements GameEvent {

    @Override
    public EventType type() {
        return EventType.PLAYER_DISCONNECT;
    }
}
