package com.sandstormtracker.watcher;

import com.sandstormtracker.config.TrackerProperties;
import com.sandstormtracker.event.EventType;
import com.sandstormtracker.event.GameEvent;
import com.sandstormtracker.event.MapChangeEvent;
import com.sandstormtracker.parser.LogLineParser;
import com.sandstormtracker.parser.LogTimestamps;
import com.sandstormtracker.parser.ServerContext;
import com.sandstormtracker.service.LogIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * One-time reconstruction of the match in progress when a server is first seen.
 * <ol>
 *   <li>Pick a freshness threshold: short if the log tail shows recent RCON traffic, long otherwise.</li>
 *   <li>Give up when the file was modified longer ago than the threshold.</li>
 *   <li>Find the newest map marker within the marker window. A map load completing a travel anchors at the travel.</li>
 *   <li>Replay every complete line from the marker to the size seen at start, without contacting the game server.</li>
 * </ol>
 * The returned offset is where steady-state reading starts, so no line is applied twice. The
 * anchor and every applied line are reported as the replay goes, which lets a restart during the
 * replay resume at the anchor and skip what was already applied.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatchupEngine {

    private final LogLineParser parser;
    private final LogIngestionService ingestionService;
    private final TrackerProperties properties;
    private final Clock clock;

    public record Result(boolean replayed, long endOffset, int events, LocalDateTime anchoredAt) {

        static Result skipped(long endOffset) {
            return new Result(false, endOffset, 0, null);
        }
    }

    /**
     * Told where a replay starts and how far it got, so an interrupted replay can be
     * resumed from the anchor instead of being started over.
     */
    public interface ReplayProgress {

        ReplayProgress NONE = new ReplayProgress() {};

        default void anchored(long anchorOffset) {}

        default void applied(long endOffset) {}
    }

    public Result run(String serverId, Path logPath) throws IOException {
        return run(serverId, logPath, ReplayProgress.NONE);
    }

    public Result run(String serverId, Path logPath, ReplayProgress progress) throws IOException {
        TrackerProperties.Catchup config = properties.getCatchup();
        long size = Files.size(logPath);
        if (!config.isEnabled()) {
            return Result.skipped(size);
        }

        boolean live = hasRecentRconActivity(logPath, config);
        Duration threshold = live ? config.getShortThreshold() : config.getLongThreshold();
        Instant modified = Files.getLastModifiedTime(logPath).toInstant();
        Duration age = Duration.between(modified, clock.instant());
        if (age.compareTo(threshold) > 0) {
            log.info("[{}] Log last modified {}s ago (threshold {}s, live={}), skipping catch-up",
                serverId, age.toSeconds(), threshold.toSeconds(), live);
            return Result.skipped(size);
        }

        Optional<Marker> marker = findAnchor(serverId, logPath, size);
        LocalDateTime now = LocalDateTime.now(clock);
        if (marker.isEmpty() || marker.get().event().timestamp().isBefore(now.minus(config.getMarkerWindow()))) {
            log.info("[{}] No map marker within the last {}m, skipping catch-up",
                serverId, config.getMarkerWindow().toMinutes());
            return Result.skipped(size);
        }

        Marker anchor = marker.get();
        progress.anchored(anchor.startOffset());
        ServerContext context = ingestionService.contextFor(serverId);
        int[] events = {0};
        long endOffset = LogFiles.forEachLine(logPath, anchor.startOffset(), size, line -> {
            if (ingestionService.apply(context, line.text(), true).isPresent()) {
                events[0]++;
                progress.applied(line.endOffset());
            }
        });

        log.info("[{}] Catch-up replayed {} events from {} {} ({}s ago), resuming at offset {}",
            serverId, events[0], anchor.event().type(), anchor.event().map(),
            Duration.between(anchor.event().timestamp(), now).toSeconds(), endOffset);
        return new Result(true, endOffset, events[0], anchor.event().timestamp());
    }

    boolean hasRecentRconActivity(Path logPath, TrackerProperties.Catchup config) throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minus(config.getLivenessWindow());
        return LogFiles.tail(logPath, config.getTailLines()).stream()
            .filter(LogLineParser::isRconActivity)
            .map(LogTimestamps::fromLine)
            .flatMap(Optional::stream)
            .anyMatch(at -> !at.isBefore(cutoff));
    }

    private Optional<Marker> findAnchor(String serverId, Path logPath, long size) throws IOException {
        ServerContext scratch = new ServerContext(serverId);
        Duration continuationWindow = properties.getWatcher().getDisconnectSuppressionWindow();
        Marker[] newest = {null};
        Marker[] previous = {null};

        LogFiles.forEachLine(logPath, 0, size, line -> {
            String text = line.text();
            if (!text.contains("LoadMap: ") && !text.contains("ProcessServerTravel: ")) {
                return;
            }
            Optional<GameEvent> event = parser.parse(text, scratch);
            if (event.isPresent() && event.get() instanceof MapChangeEvent change) {
                previous[0] = newest[0];
                newest[0] = new Marker(change, line.startOffset());
            }
        });

        if (newest[0] == null) {
            return Optional.empty();
        }
        Marker last = newest[0];
        Marker before = previous[0];
        if (last.event().type() == EventType.MAP_LOAD && before != null && before.event().travel()
                && before.event().map().equalsIgnoreCase(last.event().map())
                && !last.event().timestamp().isAfter(before.event().timestamp().plus(continuationWindow))) {
            return Optional.of(before);
        }
        return Optional.of(last);
    }

    private record Marker(MapChangeEvent event, long startOffset) {}
}
