package com.sandstormtracker.event;

/**
 * A player token as it appears in a log line: {@code Name[platformId, team N]}.
 * Bots carry the {@value #BOT_SENTINEL} id and team is {@link #NO_TEAM} when the line omits it.
 */
public record PlayerRef(String name, String platformId, int team) {

    public static final String BOT_SENTINEL = "INVALID";
    public static final int NO_TEAM = -1;

    public boolean isBot() {
        return platformId == null || platformId.isBlank() || BOT_SENTINEL.equals(platformId);
    }

    public boolean hasTeam() {
        return team >= 0;
    }
}
