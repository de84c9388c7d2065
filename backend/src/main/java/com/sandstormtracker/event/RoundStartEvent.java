package com.sandstormtracker.event;

import java.time.LocalDateTime;

public record RoundStartEvent(LocalDateTime timestamp, int round) implements GameEvent {

    @Override
    public EventType type() {
        return EventType.ROUND_START;
    }
}
