package com.sandstormtracker.event;

import java.time.LocalDateTime;

public record LogFileOpenEvent(LocalDateTime timestamp) implements GameEvent {

    @Override
    public EventType type() {
        return EventType.LOG_FILE_OPEN;
    }
}
