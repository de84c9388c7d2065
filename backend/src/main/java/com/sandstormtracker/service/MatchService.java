package com.sandstormtracker.service;

import com.sandstormtracker.config.TrackerProperties;
import com.sandstormtracker.event.GameEvent;
import com.sandstormtracker.event.MapChangeEvent;
import com.sandstormtracker.model.mongo.Match;
import com.sandstormtracker.model.mongo.MatchOrigin;
import com.sandstormtracker.model.mongo.MatchStatus;
import com.sandstormtracker.model.mongo.PlayerMatchStatus;
import com.sandstormtracker.parser.LogLineParser;
import com.sandstormtracker.parser.ServerContext;
import com.sandstormtracker.service.store.StatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Match lifecycle per server: {@code none -> ONGOING -> FINISHED | CRASHED}.
 * <p>
 * At most one match per server is ongoing. Finding more than one is repaired on
 * the spot by crashing all but the newest.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchService {

    private final StatStore statStore;
    private final StatWriteService statWriteService;
    private final TrackerProperties properties;
    private final LogLineParser parser;

    public Optional<Match> getActiveMatch(String serverId) {
        List<Match> ongoing = statStore.findOngoingMatches(serverId);
        if (ongoing.isEmpty()) {
            return Optional.empty();
        }
        if (ongoing.size() > 1) {
            log.error("[{}] {} ongoing matches found, crashing all but the newest", serverId, ongoing.size());
            for (Match stale : ongoing.subList(0, ongoing.size() - 1)) {
                LocalDateTime at = stale.getUpdatedAt() != null ? stale.getUpdatedAt() : stale.getStartTime();
                close(serverId, stale, MatchStatus.CRASHED, PlayerMatchStatus.DISCONNECTED, at);
            }
        }
        return Optional.of(ongoing.get(ongoing.size() - 1));
    }

    /**
     * Opens the match a map change announces, ending whatever was ongoing. A map load
     * that completes a recent travel to the same map continues the travel's match.
     */
    public Optional<Match> startMatch(String serverId, MapChangeEvent event) {
        Optional<Match> active = getActiveMatch(serverId);

        if (active.isPresent() && continuesTravel(active.get(), event)) {
            Match match = active.get();
            statWriteService.execute("updateMatchDetails", serverId,
                () -> statStore.updateMatchDetails(match.getId(), event.maxPlayers(), event.lighting()));
            log.info("[{}] Map load completes travel to {}, continuing match {}", serverId, event.map(), match.getId());
            return active;
        }

        active.ifPresent(previous ->
            close(serverId, previous, MatchStatus.FINISHED, PlayerMatchStatus.FINISHED, event.timestamp()));

        Match match = newMatch(serverId, event, event.travel() ? MatchOrigin.MAP_TRAVEL : MatchOrigin.MAP_LOAD)
            .startTime(event.timestamp())
            .build();

        return Optional.ofNullable(statWriteService.executeAndGet("createMatch", serverId, () -> statStore.createMatch(match)));
    }

    /**
     * The ongoing match, or a match reopened for gameplay that arrives without one, after a
     * crash or when watching started at end of file. The reopened match takes its map from the
     * newest map change at or before {@code at}, remembered or found in the log, as long as that
     * map change did not already open the latest match. Gameplay after a finished game with no
     * newer map change waits for the next map change.
     */
    public Optional<Match> getOrReopenMatch(ServerContext context, LocalDateTime at) {
        String serverId = context.getServerId();
        Optional<Match> active = getActiveMatch(serverId);
        if (active.isPresent()) {
            return active;
        }

        Optional<Match> latest = statStore.findLatestMatch(serverId);
        Optional<MapChangeEvent> marker = lastMapChange(context, at)
            .filter(change -> latest.map(match -> openedAfter(change, match)).orElse(true));
        if (marker.isEmpty() && latest.isPresent() && latest.get().getStatus() == MatchStatus.FINISHED) {
            return Optional.empty();
        }

        Match match = marker
            .map(change -> newMatch(serverId, change, MatchOrigin.REOPENED).startTime(change.timestamp()))
            .orElseGet(() -> Match.builder()
                .serverId(serverId)
                .origin(MatchOrigin.REOPENED)
                .round(0)
                .status(MatchStatus.ONGOING)
                .startTime(at))
            .build();

        Optional<Match> reopened = Optional.ofNullable(
            statWriteService.executeAndGet("createMatch", serverId, () -> statStore.createMatch(match)));
        reopened.ifPresent(created -> log.info("[{}] No ongoing match at {}, reopened match {} on {}", serverId, at,
            created.getId(), created.getMap() != null ? created.getMap() : "an unknown map"));
        return reopened;
    }

    public Optional<Match> endActiveMatch(String serverId, MatchStatus status, PlayerMatchStatus statStatus,
                                          LocalDateTime at) {
        Optional<Match> active = getActiveMatch(serverId);
        active.ifPresent(match -> close(serverId, match, status, statStatus, at));
        return active;
    }

    private void close(String serverId, Match match, MatchStatus status, PlayerMatchStatus statStatus,
                       LocalDateTime at) {
        statWriteService.execute("endMatch", serverId, () -> statStore.endMatch(match.getId(), status, at));
        statWriteService.execute("closeAllStats", serverId, () -> statStore.closeAllStats(match.getId(), statStatus, at));
        log.info("[{}] Match {} on {} ended as {} after {} rounds", serverId, match.getId(), match.getMap(), status,
            match.getRound());
    }

    private static Match.MatchBuilder newMatch(String serverId, MapChangeEvent event, MatchOrigin origin) {
        return Match.builder()
            .serverId(serverId)
            .map(event.map())
            .scenario(event.scenario())
            .mode(event.mode())
            .playerTeam(event.playerTeam())
            .maxPlayers(event.maxPlayers())
            .lighting(event.lighting())
            .origin(origin)
            .round(0)
            .status(MatchStatus.ONGOING);
    }

    private Optional<MapChangeEvent> lastMapChange(ServerContext context, LocalDateTime at) {
        MapChangeEvent remembered = context.getLastMapChange();
        if (remembered != null && !remembered.timestamp().isAfter(at)) {
            return Optional.of(remembered);
        }
        Path logPath = context.getLogPath();
        if (logPath == null || !Files.exists(logPath)) {
            return Optional.empty();
        }
        try {
            return findLastMapChange(context.getServerId(), logPath, at);
        } catch (IOException e) {
            log.warn("[{}] Could not search {} for the last map change: {}", context.getServerId(), logPath,
                e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<MapChangeEvent> findLastMapChange(String serverId, Path logPath, LocalDateTime at)
            throws IOException {
        ServerContext scratch = new ServerContext(serverId);
        MapChangeEvent newest = null;
        try (BufferedReader reader = Files.newBufferedReader(logPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.contains("LoadMap: ") && !line.contains("ProcessServerTravel: ")) {
                    continue;
                }
                Optional<GameEvent> event = parser.parse(line, scratch);
                if (event.isPresent() && event.get() instanceof MapChangeEvent change
                        && !change.timestamp().isAfter(at)) {
                    newest = change;
                }
            }
        }
        return Optional.ofNullable(newest);
    }

    private static boolean openedAfter(MapChangeEvent change, Match match) {
        return match.getStartTime() == null || change.timestamp().isAfter(match.getStartTime());
    }

    private boolean continuesTravel(Match active, MapChangeEvent event) {
        if (event.travel() || active.getOrigin() != MatchOrigin.MAP_TRAVEL) {
            return false;
        }
        if (active.getMap() == null || !active.getMap().equalsIgnoreCase(event.map())) {
            return false;
        }
        Duration window = properties.getWatcher().getDisconnectSuppressionWindow();
        LocalDateTime started = active.getStartTime();
        return started != null
            && !event.timestamp().isBefore(started)
            && !event.timestamp().isAfter(started.plus(window));
    }
}
