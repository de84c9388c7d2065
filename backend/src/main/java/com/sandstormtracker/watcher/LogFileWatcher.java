package com.sandstormtracker.watcher;

import com.sandstormtracker.config.TrackerProperties;
import com.sandstormtracker.config.TrackerProperties.ServerProperties;
import com.sandstormtracker.model.mongo.Server;
import com.sandstormtracker.parser.ServerContext;
import com.sandstormtracker.service.LogIngestionService;
import com.sandstormtracker.service.StatWriteService;
import com.sandstormtracker.service.store.StatStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Tails every enabled server log.
 * <p>
 * Each server has a single-threaded worker, so its lines are applied strictly in
 * order while servers proceed in parallel. File notifications and the fallback poll
 * only request a scan; requests inside the coalesce window collapse into one. A scan
 * always reads from the last processed offset, so coalescing never skips bytes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LogFileWatcher {

    private final TrackerProperties properties;
    private final StatStore statStore;
    private final StatWriteService statWriteService;
    private final LogIngestionService ingestionService;
    private final CatchupEngine catchupEngine;
    private final ServerActivityTracker activityTracker;

    private final Map<String, ServerRuntimeState> states = new ConcurrentHashMap<>();
    private final Map<Path, List<ServerRuntimeState>> byDirectory = new ConcurrentHashMap<>();

    private volatile WatchService watchService;
    private volatile Thread watchThread;
    private volatile boolean running;

    // ========== Lifecycle ==========

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (running) {
            return;
        }
        running = true;
        List<ServerProperties> servers = properties.enabledServers();
        for (ServerProperties server : servers) {
            register(server);
        }
        startWatchThread();
        log.info("Watching {} server logs", servers.size());
    }

    @PreDestroy
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        closeWatchService();

        long deadline = System.nanoTime() + properties.getWatcher().getShutdownTimeout().toNanos();
        for (ServerRuntimeState state : states.values()) {
            state.getWorker().shutdown();
        }
        try {
            for (ServerRuntimeState state : states.values()) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!state.getWorker().awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("[{}] Worker did not drain within {}s, abandoning backlog", state.getServerId(),
                        properties.getWatcher().getShutdownTimeout().toSeconds());
                    state.getWorker().shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            states.values().forEach(state -> state.getWorker().shutdownNow());
            Thread.currentThread().interrupt();
        }
        log.info("Log watcher stopped");
    }

    public Optional<ServerRuntimeState> state(String serverId) {
        return Optional.ofNullable(states.get(serverId));
    }

    /** Queues an immediate scan on the server's worker, bypassing coalescing. */
    public Future<?> rescan(String serverId) {
        ServerRuntimeState state = states.get(serverId);
        if (state == null) {
            throw new RuntimeException("Server not watched: " + serverId);
        }
        return state.getWorker().submit(() -> scan(state));
    }

    // ========== Registration ==========

    private void register(ServerProperties server) {
        String serverId = server.resolveId();
        Path logPath = Path.of(server.getLogPath()).toAbsolutePath().normalize();
        ScheduledExecutorService worker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "log-" + serverId);
            thread.setDaemon(true);
            return thread;
        });

        ServerContext context = ingestionService.contextFor(serverId);
        context.setLogPath(logPath);
        ServerRuntimeState state = new ServerRuntimeState(serverId, logPath, context, worker);
        states.put(serverId, state);
        byDirectory.computeIfAbsent(logPath.getParent(), dir -> new CopyOnWriteArrayList<>()).add(state);

        worker.execute(() -> initialize(state, server));
        long pollMillis = properties.getWatcher().getPollInterval().toMillis();
        worker.scheduleWithFixedDelay(() -> requestScan(state), pollMillis, pollMillis, TimeUnit.MILLISECONDS);
    }

    private void initialize(ServerRuntimeState state, ServerProperties config) {
        String serverId = state.getServerId();
        Path logPath = state.getLogPath();
        try {
            Server server = statStore.registerServer(serverId, config.resolveName(), logPath.toString());

            if (server != null && server.getOffset() != null) {
                state.setOffset(server.getOffset());
                state.setAppliedOffset(server.getAppliedOffset() != null ? server.getAppliedOffset() : server.getOffset());
                state.setLogFileCreationTime(server.getLogFileCreationTime());
                log.info("[{}] Resuming {} at offset {}", serverId, logPath, server.getOffset());
            } else if (Files.exists(logPath)) {
                state.setLogFileCreationTime(LogFiles.readOpenTimestamp(logPath).orElse(null));
                CatchupEngine.Result result = catchupEngine.run(serverId, logPath, replayProgress(state));
                state.setOffset(result.endOffset());
                state.setAppliedOffset(result.endOffset());
                persistOffsets(state);
                if (!result.replayed()) {
                    log.info("[{}] Starting at end of {} (offset {})", serverId, logPath, result.endOffset());
                }
            } else {
                log.warn("[{}] Log {} does not exist yet, waiting for it", serverId, logPath);
            }
        } catch (IOException | RuntimeException e) {
            log.error("[{}] Could not prepare {}, starting at end of file", serverId, logPath, e);
            startAtEnd(state);
        }
        state.setInitialized(true);
    }

    // persists catch-up progress the way a scan does, so a restart mid-replay resumes at the anchor
    private CatchupEngine.ReplayProgress replayProgress(ServerRuntimeState state) {
        String serverId = state.getServerId();
        return new CatchupEngine.ReplayProgress() {
            @Override
            public void anchored(long anchorOffset) {
                state.setOffset(anchorOffset);
                state.setAppliedOffset(anchorOffset);
                persistOffsets(state);
            }

            @Override
            public void applied(long endOffset) {
                state.setAppliedOffset(endOffset);
                statWriteService.execute("saveAppliedOffset", serverId,
                    () -> statStore.saveAppliedOffset(serverId, endOffset));
            }
        };
    }

    private void startAtEnd(ServerRuntimeState state) {
        try {
            long size = Files.exists(state.getLogPath()) ? Files.size(state.getLogPath()) : 0;
            state.setOffset(size);
            state.setAppliedOffset(size);
            state.setLogFileCreationTime(LogFiles.readOpenTimestamp(state.getLogPath()).orElse(null));
        } catch (IOException e) {
            log.warn("[{}] Could not size {}: {}", state.getServerId(), state.getLogPath(), e.getMessage());
        }
    }

    // ========== Scanning ==========

    void requestScan(ServerRuntimeState state) {
        if (!state.getScanPending().compareAndSet(false, true)) {
            return;
        }
        try {
            state.getWorker().schedule(() -> {
                state.getScanPending().set(false);
                scan(state);
            }, properties.getWatcher().getCoalesceWindow().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // worker already shut down
            state.getScanPending().set(false);
            log.debug("[{}] Scan request rejected: {}", state.getServerId(), e.getMessage());
        }
    }

    void scan(ServerRuntimeState state) {
        if (!state.isInitialized() || !Files.exists(state.getLogPath())) {
            return;
        }
        String serverId = state.getServerId();
        Path logPath = state.getLogPath();
        try {
            long size = Files.size(logPath);
            Optional<LocalDateTime> openedAt = LogFiles.readOpenTimestamp(logPath);

            boolean reopened = openedAt.isPresent() && state.getLogFileCreationTime() != null
                && !openedAt.get().equals(state.getLogFileCreationTime());
            if (size < state.getOffset() || reopened) {
                log.info("[{}] Log rotated (size {} < offset {} or reopened at {}), reading from start",
                    serverId, size, state.getOffset(), openedAt.orElse(null));
                state.setOffset(0);
                state.setAppliedOffset(0);
                statWriteService.execute("saveAppliedOffset", serverId, () -> statStore.saveAppliedOffset(serverId, 0));
            }
            openedAt.ifPresent(state::setLogFileCreationTime);

            if (size == state.getOffset()) {
                return;
            }

            int[] processed = {0};
            long end = LogFiles.forEachLine(logPath, state.getOffset(), size, line -> {
                processed[0]++;
                if (line.endOffset() <= state.getAppliedOffset()) {
                    return;
                }
                if (ingestionService.apply(state.getContext(), line.text(), false).isPresent()) {
                    state.setAppliedOffset(line.endOffset());
                    statWriteService.execute("saveAppliedOffset", serverId,
                        () -> statStore.saveAppliedOffset(serverId, line.endOffset()));
                }
            });

            if (end != state.getOffset()) {
                state.setOffset(end);
                persistOffsets(state);
            }
            if (processed[0] > 0) {
                activityTracker.recordActivity(serverId);
            }
        } catch (IOException e) {
            log.warn("[{}] Could not read {}: {}", serverId, logPath, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Scan of {} failed at offset {}", serverId, logPath, state.getOffset(), e);
        }
    }

    private void persistOffsets(ServerRuntimeState state) {
        String serverId = state.getServerId();
        long offset = state.getOffset();
        long appliedOffset = Math.max(offset, state.getAppliedOffset());
        LocalDateTime openedAt = state.getLogFileCreationTime();
        statWriteService.execute("saveReadOffset", serverId,
            () -> statStore.saveReadOffset(serverId, openedAt, offset));
        statWriteService.execute("saveAppliedOffset", serverId,
            () -> statStore.saveAppliedOffset(serverId, appliedOffset));
    }

    // ========== File notifications ==========

    private void startWatchThread() {
        try {
            WatchService service = FileSystems.getDefault().newWatchService();
            for (Path directory : byDirectory.keySet()) {
                if (Files.isDirectory(directory)) {
                    directory.register(service, StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY);
                } else {
                    log.warn("Log directory {} does not exist, relying on polling", directory);
                }
            }
            watchService = service;
        } catch (IOException e) {
            log.warn("File notifications unavailable, relying on polling: {}", e.getMessage());
            return;
        }

        Thread thread = new Thread(this::watchLoop, "log-watch");
        thread.setDaemon(true);
        watchThread = thread;
        thread.start();
    }

    private void watchLoop() {
        WatchService service = watchService;
        while (running) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            Path directory = (Path) key.watchable();
            List<ServerRuntimeState> watched = byDirectory.getOrDefault(directory, List.of());
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    watched.forEach(this::requestScan);
                    continue;
                }
                Path changed = directory.resolve((Path) event.context());
                for (ServerRuntimeState state : watched) {
                    if (state.getLogPath().equals(changed)) {
                        requestScan(state);
                    }
                }
            }
            key.reset();
        }
    }

    private void closeWatchService() {
        WatchService service = watchService;
        if (service == null) {
            return;
        }
        try {
            service.close();
        } catch (IOException e) {
            log.warn("Could not close watch service: {}", e.getMessage());
        }
        Thread thread = watchThread;
        if (thread != null) {
            thread.interrupt();
        }
    }
}
