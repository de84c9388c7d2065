package com.sandstormtracker.watcher;

import com.sandstormtracker.parser.ServerContext;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watcher state for one server. Mutated only on the server's own worker thread;
 * offsets are volatile so other threads can observe progress.
 */
@Getter
@Setter
public class ServerRuntimeState {

    private final String serverId;
    private final Path logPath;
    private final ServerContext context;
    private final ScheduledExecutorService worker;
    private final AtomicBoolean scanPending = new AtomicBoolean();

    private volatile long offset;
    private volatile long appliedOffset;
    private volatile LocalDateTime logFileCreationTime;
    private volatile boolean initialized;

    public ServerRuntimeState(String serverId, Path logPath, ServerContext context, ScheduledExecutorService worker) {
        this.serverId = serverId;
        this.logPath = logPath;
        this.context = context;
        this.worker = worker;
    }
}
