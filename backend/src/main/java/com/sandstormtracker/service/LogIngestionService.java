package com.sandstormtracker.service;

import com.sandstormtracker.event.GameEvent;
import com.sandstormtracker.parser.LogLineParser;
import com.sandstormtracker.parser.ServerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Line-level entry point shared by the watcher, catch-up and external callers.
 * <p>
 * Callers must keep one thread per server: the server context is not synchronized.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogIngestionService {

    private final LogLineParser parser;
    private final GameEventHandler eventHandler;

    private final Map<String, ServerContext> contexts = new ConcurrentHashMap<>();

    public ServerContext contextFor(String serverId) {
        return contexts.computeIfAbsent(serverId, ServerContext::new);
    }

    public Optional<GameEvent> processLine(String serverId, String line) {
        return apply(contextFor(serverId), line, false);
    }

    /**
     * Replays a whole file in catch-up mode: state is rebuilt, the game server is not contacted.
     *
     * @return number of events applied
     */
    public int processFile(String serverId, Path path) throws IOException {
        ServerContext context = contextFor(serverId);
        context.setLogPath(path);
        int applied = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (apply(context, line, true).isPresent()) {
                    applied++;
                }
            }
        }
        log.info("[{}] Replayed {}: {} events applied", serverId, path, applied);
        return applied;
    }

    /**
     * Parses and applies one line. A failure while applying is logged and the line dropped.
     *
     * @return the applied event, empty if the line carried none or could not be applied
     */
    public Optional<GameEvent> apply(ServerContext context, String line, boolean catchup) {
        Optional<GameEvent> event = parser.parse(line, context);
        if (event.isEmpty()) {
            return event;
        }
        try {
            eventHandler.handle(context, event.get(), catchup);
            return event;
        } catch (RuntimeException e) {
            log.error("[{}] Dropping {} event at {}", context.getServerId(), event.get().type(),
                event.get().timestamp(), e);
            return Optional.empty();
        }
    }
}
