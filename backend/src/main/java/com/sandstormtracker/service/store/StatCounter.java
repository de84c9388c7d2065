package com.sandstormtracker.service.store;

/**
 * Monotonic per-(match, player) counters and the document field each one lives in.
 */
public enum StatCounter {
    KILLS("kills"),
    ASSISTS("assists"),
    DEATHS("deaths"),
    FRIENDLY_FIRE_KILLS("friendlyFireKills"),
    OBJECTIVES_CAPTURED("objectivesCaptured"),
    OBJECTIVES_DESTROYED("objectivesDestroyed");

    private final String field;

    StatCounter(String field) {
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
