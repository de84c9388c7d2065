package com.sandstormtracker.service;

import com.sandstormtracker.config.TrackerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Coalesces bursts of score-relevant events into one reconciliation per server.
 * <p>
 * Each trigger restarts the quiet window, but a burst never waits longer than
 * {@code maxWait} after its first trigger. Reconciliation runs on the score
 * scheduler, never on the caller's thread.
 */
@Service
@Slf4j
public class ScoreDebouncer {

    private final ScoreReconciliationService reconciliationService;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration window;
    private final Duration maxWait;

    private final Map<String, Burst> bursts = new ConcurrentHashMap<>();

    @Autowired
    public ScoreDebouncer(ScoreReconciliationService reconciliationService,
                          @Qualifier("scoreScheduler") TaskScheduler scheduler,
                          Clock clock,
                          TrackerProperties properties) {
        this(reconciliationService, scheduler, clock,
            properties.getScores().getDebounceWindow(), properties.getScores().getMaxWait());
    }

    public ScoreDebouncer(ScoreReconciliationService reconciliationService, TaskScheduler scheduler,
                          Clock clock, Duration window, Duration maxWait) {
        this.reconciliationService = reconciliationService;
        this.scheduler = scheduler;
        this.clock = clock;
        this.window = window;
        this.maxWait = maxWait;
    }

    public void trigger(String serverId) {
        bursts.compute(serverId, (id, burst) -> {
            Instant now = clock.instant();
            Burst current = burst != null ? burst : new Burst(now);
            current.cancelTimer();

            Instant deadline = current.firstTriggerAt.plus(maxWait);
            if (!now.isBefore(deadline)) {
                log.debug("[{}] Score debounce hit max wait, reconciling now", id);
                scheduler.schedule(() -> fire(id), now);
                return null;
            }

            Instant fireAt = now.plus(window);
            if (fireAt.isAfter(deadline)) {
                fireAt = deadline;
            }
            schedule(id, current, fireAt);
            return current;
        });
    }

    /** Drops any pending burst and reconciles right away. */
    public void executeImmediately(String serverId) {
        cancel(serverId);
        scheduler.schedule(() -> fire(serverId), clock.instant());
    }

    /** Replaces any pending burst with one that fires after a fixed delay. */
    public void triggerFixed(String serverId, Duration delay) {
        bursts.compute(serverId, (id, burst) -> {
            if (burst != null) {
                burst.cancelTimer();
            }
            Instant now = clock.instant();
            Burst fixed = new Burst(now);
            schedule(id, fixed, now.plus(delay));
            return fixed;
        });
    }

    public void cancel(String serverId) {
        Burst burst = bursts.remove(serverId);
        if (burst != null) {
            burst.cancelTimer();
        }
    }

    public boolean isPending(String serverId) {
        return bursts.containsKey(serverId);
    }

    @PreDestroy
    public void stop() {
        bursts.keySet().forEach(this::cancel);
        log.info("Score debouncer stopped");
    }

    private void schedule(String serverId, Burst burst, Instant fireAt) {
        long generation = ++burst.generation;
        burst.timer = scheduler.schedule(() -> fire(serverId, burst, generation), fireAt);
    }

    private void fire(String serverId, Burst burst, long generation) {
        if (!claim(serverId, burst, generation)) {
            log.debug("[{}] Superseded score timer skipped", serverId);
            return;
        }
        fire(serverId);
    }

    // a timer already running when its burst was rescheduled or cancelled loses the claim
    private boolean claim(String serverId, Burst burst, long generation) {
        boolean[] claimed = {false};
        bursts.computeIfPresent(serverId, (id, current) -> {
            if (current == burst && current.generation == generation) {
                claimed[0] = true;
                return null;
            }
            return current;
        });
        return claimed[0];
    }

    private void fire(String serverId) {
        try {
            reconciliationService.reconcile(serverId);
        } catch (RuntimeException e) {
            log.error("[{}] Score reconciliation failed", serverId, e);
        }
    }

    private static final class Burst {
        private final Instant firstTriggerAt;
        private ScheduledFuture<?> timer;
        // bumped on every reschedule, only changed under the map's lock for this server
        private long generation;

        private Burst(Instant firstTriggerAt) {
            this.firstTriggerAt = firstTriggerAt;
        }

        private void cancelTimer() {
            if (timer != null) {
                timer.cancel(false);
            }
        }
    }
}
