package com.sandstormtracker.service;

import com.sandstormtracker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RconPollingServiceTest {

    private static final Duration INTERVAL = Duration.ofSeconds(60);

    @Mock
    private ScoreReconciliationService reconciliationService;
    @Mock
    private TaskScheduler scheduler;
    @Mock
    private ScheduledFuture<?> job;

    private MutableClock clock;
    private RconPollingService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDateTime.of(2025, 11, 15, 12, 0));
        service = new RconPollingService(reconciliationService, scheduler, clock, INTERVAL);
    }

    @Test
    void pollsWhileActiveAndStopsWhenInactive() {
        doReturn(job).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        service.onActive("main");
        service.onActive("main");

        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class),
            eq(clock.instant().plus(INTERVAL)), eq(INTERVAL));
        assertThat(service.isPolling("main")).isTrue();

        service.onInactive("main");

        verify(job).cancel(false);
        assertThat(service.isPolling("main")).isFalse();
    }

    @Test
    void pollFailureIsContained() {
        doReturn(job).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        doThrow(new IllegalStateException("store down")).when(reconciliationService).reconcile("main");

        service.onActive("main");
        ArgumentCaptor<Runnable> poll = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(poll.capture(), any(Instant.class), any(Duration.class));

        assertThatCode(() -> poll.getValue().run()).doesNotThrowAnyException();
        verify(reconciliationService).reconcile("main");
    }
}
