package com.sandstormtracker.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ScoreDebouncerTest {

    private static final Duration WINDOW = Duration.ofMillis(100);
    private static final Duration MAX_WAIT = Duration.ofMillis(300);

    @Mock
    private ScoreReconciliationService reconciliationService;

    private ThreadPoolTaskScheduler scheduler;
    private ScoreDebouncer debouncer;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("score-test-");
        scheduler.initialize();
        debouncer = new ScoreDebouncer(reconciliationService, scheduler, Clock.systemUTC(), WINDOW, MAX_WAIT);
    }

    @AfterEach
    void tearDown() {
        debouncer.stop();
        scheduler.shutdown();
    }

    @Test
    void burstOfTriggersReconcilesOnce() {
        for (int i = 0; i < 5; i++) {
            debouncer.trigger("main");
        }
        assertThat(debouncer.isPending("main")).isTrue();

        verify(reconciliationService, timeout(1000).times(1)).reconcile("main");
        verify(reconciliationService, after(300).times(1)).reconcile("main");
        assertThat(debouncer.isPending("main")).isFalse();
    }

    @Test
    void steadyTriggersStillReconcileWithinMaxWait() throws InterruptedException {
        for (int i = 0; i < 12; i++) {
            debouncer.trigger("main");
            Thread.sleep(50);
        }

        verify(reconciliationService, timeout(200).atLeastOnce()).reconcile("main");
    }

    @Test
    void timerAlreadyRunningWhenRescheduledDoesNotReconcile() {
        TaskScheduler manual = mock(TaskScheduler.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        ArgumentCaptor<Runnable> timers = ArgumentCaptor.forClass(Runnable.class);
        doReturn(future).when(manual).schedule(timers.capture(), any(Instant.class));
        ScoreDebouncer manualDebouncer = new ScoreDebouncer(reconciliationService, manual, Clock.systemUTC(),
            WINDOW, MAX_WAIT);

        manualDebouncer.trigger("main");
        manualDebouncer.trigger("main");
        List<Runnable> scheduled = timers.getAllValues();
        assertThat(scheduled).hasSize(2);

        // the first timer was past cancellation when the second trigger arrived
        scheduled.get(0).run();
        verify(reconciliationService, never()).reconcile("main");
        assertThat(manualDebouncer.isPending("main")).isTrue();

        scheduled.get(1).run();
        verify(reconciliationService, times(1)).reconcile("main");
        assertThat(manualDebouncer.isPending("main")).isFalse();
    }

    @Test
    void immediateExecutionReplacesPendingBurst() {
        debouncer.trigger("main");
        debouncer.executeImmediately("main");

        assertThat(debouncer.isPending("main")).isFalse();
        verify(reconciliationService, timeout(500).times(1)).reconcile("main");
        verify(reconciliationService, after(300).times(1)).reconcile("main");
    }

    @Test
    void fixedDelayWaitsTheWholeDelay() {
        debouncer.triggerFixed("main", Duration.ofMillis(400));

        verify(reconciliationService, after(150).never()).reconcile("main");
        verify(reconciliationService, timeout(1000).times(1)).reconcile("main");
    }

    @Test
    void cancelledBurstNeverFires() {
        debouncer.trigger("main");
        debouncer.cancel("main");

        verify(reconciliationService, after(300).never()).reconcile("main");
    }

    @Test
    void serversAreDebouncedIndependently() {
        debouncer.trigger("alpha");
        debouncer.trigger("bravo");

        verify(reconciliationService, timeout(1000).times(1)).reconcile("alpha");
        verify(reconciliationService, timeout(1000).times(1)).reconcile("bravo");
    }

    @Test
    void failedReconciliationDoesNotStopLaterOnes() {
        doThrow(new IllegalStateException("store down"))
            .doNothing()
            .when(reconciliationService).reconcile("main");

        debouncer.trigger("main");
        verify(reconciliationService, timeout(1000).times(1)).reconcile("main");

        debouncer.trigger("main");
        verify(reconciliationService, timeout(1000).times(2)).reconcile("main");
    }
}
