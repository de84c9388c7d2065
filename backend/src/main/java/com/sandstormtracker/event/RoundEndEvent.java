package com.sandstormtracker.event;

import java.time.LocalDateTime;

public record RoundEndEvent(LocalDateTime timestamp, Integer round, Integer winnerTeam, String reason)
        implements GameEvent {

    @Override
    public EventType type() {
        return EventType.ROUND_END;
    }
}
