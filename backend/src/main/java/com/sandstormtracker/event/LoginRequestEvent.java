package com.sandstormtracker.event;

import java.time.LocalDateTime;

public record LoginRequestEvent(LocalDateTime timestamp, String name, String platformId, String platform)
        implements GameEvent {

    @Override
    public EventType type() {
        return EventType.LOGIN_REQUEST;
    }
}
