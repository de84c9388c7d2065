package com.sandstormtracker.event;

import java.time.LocalDateTime;

// Anti-cheat accepted the client; the platform id is authenticated from here on.
public record PlayerRegisterEvent(LocalDateTime timestamp, String platformId) implements GameEvent {

    @Override
    public EventType type() {
        return EventType.PLAYER_REGISTER;
    }
}
