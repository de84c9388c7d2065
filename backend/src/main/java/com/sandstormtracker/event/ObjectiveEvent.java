package com.sandstormtracker.event;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Capture or destruction of an objective. For captures {@code ownerTeam} is the team it was taken from.
 */
public record ObjectiveEvent(
        EventType type,
        LocalDateTime timestamp,
        int objectiveId,
        int ownerTeam,
        int forTeam,
        List<PlayerRef> players) implements GameEvent {

    public ObjectiveEvent {
        if (type != EventType.OBJECTIVE_CAPTURED && type != EventType.OBJECTIVE_DESTROYED) {
            throw new IllegalArgumentException("Not an objective event type: " + type);
        }
        players = List.copyOf(players);
    }

    public boolean captured() {
        return type == EventType.OBJECTIVE_CAPTURED;
    }
}
