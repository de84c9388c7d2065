package com.sandstormtracker.event;

import java.time.LocalDateTime;

public record GameOverEvent(LocalDateTime timestamp) implements GameEvent {

    @Override
    public EventType type() {
        return EventType.GAME_OVER;
    }
}
