package com.sandstormtracker.parser;

import com.sandstormtracker.event.MapChangeEvent;
import lombok.Data;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-server state carried between lines. Owned by the server's worker, never shared.
 */
@Data
public class ServerContext {
    private final String serverId;
    private LocalDateTime lastMapTravelAt;
    private MapChangeEvent lastMapChange;
    // log being read for this server, if any; searched when a match has to be reopened
    private Path logPath;

    // player name -> platform id, from login requests not yet matched to a join
    private final Map<String, String> pendingLogins = new HashMap<>();

    public void rememberLogin(String name, String platformId) {
        pendingLogins.put(name, platformId);
    }

    public Optional<String> pendingPlatformId(String name) {
        return Optional.ofNullable(pendingLogins.get(name));
    }

    public Optional<String> pendingName(String platformId) {
        return pendingLogins.entrySet().stream()
            .filter(entry -> entry.getValue().equals(platformId))
            .map(Map.Entry::getKey)
            .findFirst();
    }

    public void forgetLogin(String name) {
        pendingLogins.remove(name);
    }
}
