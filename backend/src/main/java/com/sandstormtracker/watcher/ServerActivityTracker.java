package com.sandstormtracker.watcher;

import com.sandstormtracker.config.TrackerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Turns processed-line activity into edge-triggered active/inactive notifications.
 * A server goes inactive after {@code tracker.watcher.inactivity-timeout} without a processed line.
 */
@Component
@Slf4j
public class ServerActivityTracker {

    private final List<ServerActivityListener> listeners;
    private final Clock clock;
    private final Duration inactivityTimeout;

    private final Map<String, Instant> lastActivity = new ConcurrentHashMap<>();
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    @Autowired
    public ServerActivityTracker(List<ServerActivityListener> listeners, Clock clock, TrackerProperties properties) {
        this(listeners, clock, properties.getWatcher().getInactivityTimeout());
    }

    public ServerActivityTracker(List<ServerActivityListener> listeners, Clock clock, Duration inactivityTimeout) {
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
        this.inactivityTimeout = inactivityTimeout;
    }

    public void recordActivity(String serverId) {
        lastActivity.put(serverId, clock.instant());
        if (active.add(serverId)) {
            log.info("[{}] Server active", serverId);
            notifyListeners(serverId, listener -> listener.onActive(serverId));
        }
    }

    @Scheduled(fixedDelay = 1000)
    public void checkInactivity() {
        Instant now = clock.instant();
        for (String serverId : active) {
            Instant last = lastActivity.get(serverId);
            if (last != null && Duration.between(last, now).compareTo(inactivityTimeout) >= 0 && active.remove(serverId)) {
                log.info("[{}] Server inactive for {}s", serverId, inactivityTimeout.toSeconds());
                notifyListeners(serverId, listener -> listener.onInactive(serverId));
            }
        }
    }

    public boolean isActive(String serverId) {
        return active.contains(serverId);
    }

    private void notifyListeners(String serverId, Consumer<ServerActivityListener> notification) {
        for (ServerActivityListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.error("[{}] Activity listener {} failed", serverId, listener.getClass().getSimpleName(), e);
            }
        }
    }
}
