package com.sandstormtracker.event;

import java.time.LocalDateTime;

/**
 * A single domain event produced from one log line.
 * <p>
 * The set of variants is closed; consumers switch over {@link #type()} and the
 * compiler rejects a switch expression that misses one.
 */
public sealed interface GameEvent permits
        LogFileOpenEvent,
        LoginRequestEvent,
        PlayerRegisterEvent,
        PlayerJoinEvent,
        PlayerLeaveEvent,
        PlayerDisconnectEvent,
        KillEvent,
        ObjectiveEvent,
        RoundStartEvent,
        RoundEndEvent,
        MapChangeEvent,
        GameOverEvent,
        ChatCommandEvent {

    EventType type();

    /** Log-local time of the line. */
    LocalDateTime timestamp();
}
