package com.sandstormtracker.service;

import com.sandstormtracker.config.TrackerProperties;
import com.sandstormtracker.watcher.ServerActivityListener;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

// ========== RCON Polling Service ==========
// Periodic score reconciliation, running only while a server's log is active.
@Service
@Slf4j
public class RconPollingService implements ServerActivityListener {

    private final ScoreReconciliationService reconciliationService;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration pollInterval;

    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();

    @Autowired
    public RconPollingService(ScoreReconciliationService reconciliationService,
                              @Qualifier("scoreScheduler") TaskScheduler scheduler,
                              Clock clock,
                              TrackerProperties properties) {
        this(reconciliationService, scheduler, clock, properties.getScores().getPollInterval());
    }

    public RconPollingService(ScoreReconciliationService reconciliationService, TaskScheduler scheduler,
                              Clock clock, Duration pollInterval) {
        this.reconciliationService = reconciliationService;
        this.scheduler = scheduler;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    @Override
    public void onActive(String serverId) {
        jobs.compute(serverId, (id, existing) -> {
            if (existing != null && !existing.isDone()) {
                return existing;
            }
            log.info("[{}] Starting RCON polling every {}s", id, pollInterval.toSeconds());
            return scheduler.scheduleAtFixedRate(() -> poll(id), clock.instant().plus(pollInterval), pollInterval);
        });
    }

    @Override
    public void onInactive(String serverId) {
        ScheduledFuture<?> job = jobs.remove(serverId);
        if (job != null) {
            job.cancel(false);
            log.info("[{}] Stopped RCON polling", serverId);
        }
    }

    public boolean isPolling(String serverId) {
        return jobs.containsKey(serverId);
    }

    @PreDestroy
    public void stop() {
        jobs.keySet().forEach(this::onInactive);
    }

    private void poll(String serverId) {
        try {
            reconciliationService.reconcile(serverId);
        } catch (RuntimeException e) {
            log.error("[{}] Periodic score reconciliation failed", serverId, e);
        }
    }
}
