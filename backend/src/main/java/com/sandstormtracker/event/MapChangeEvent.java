package com.sandstormtracker.event;

import java.time.LocalDateTime;

/**
 * Map load at boot or a server travel. Travel lines carry no max players or lighting.
 */
public record MapChangeEvent(
        EventType type,
        LocalDateTime timestamp,
        String map,
        String scenario,
        String mode,
        String playerTeam,
        Integer maxPlayers,
        String lighting) implements GameEvent {

    public MapChangeEvent {
        if (type != EventType.MAP_LOAD && type != EventType.MAP_TRAVEL) {
            throw new IllegalArgumentException("Not a map change event type: " + type);
        }
    }

    public boolean travel() {
        return type == EventType.MAP_TRAVEL;
    }
}
