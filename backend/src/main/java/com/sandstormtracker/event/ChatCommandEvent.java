package com.sandstormtracker.event;

import java.time.LocalDateTime;

public record ChatCommandEvent(
        LocalDateTime timestamp,
        String name,
        String platformId,
        ChatCommand command,
        String arguments) implements GameEvent {

    @Override
    public EventType type() {
        return EventType.CHAT_COMMAND;
    }
}
