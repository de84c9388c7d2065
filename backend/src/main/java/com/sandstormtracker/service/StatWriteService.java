package com.sandstormtracker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Runs single store mutations with one retry.
 * <p>
 * A mutation that still fails is written to the dead letter queue and dropped, so
 * the server's queue keeps moving.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatWriteService {

    private final DeadLetterQueueService deadLetterQueueService;

    @Retryable(
        retryFor = {DataAccessException.class},
        maxAttempts = 2,
        backoff = @Backoff(delay = 100),
        recover = "recoverMutation"
    )
    public void execute(String operation, String serverId, Runnable mutation) {
        mutation.run();
    }

    @Retryable(
        retryFor = {DataAccessException.class},
        maxAttempts = 2,
        backoff = @Backoff(delay = 100),
        recover = "recoverCreation"
    )
    public <T> T executeAndGet(String operation, String serverId, Supplier<T> mutation) {
        return mutation.get();
    }

    @Recover
    public void recoverMutation(DataAccessException e, String operation, String serverId, Runnable mutation) {
        log.error("[{}] {} failed after retry, dropping it", serverId, operation, e);
        deadLetterQueueService.logFailedMutation(operation, serverId, e.getMessage());
    }

    /** Returns null: the caller treats the entity as not created. */
    @Recover
    public <T> T recoverCreation(DataAccessException e, String operation, String serverId, Supplier<T> mutation) {
        log.error("[{}] {} failed after retry, dropping it", serverId, operation, e);
        deadLetterQueueService.logFailedMutation(operation, serverId, e.getMessage());
        return null;
    }
}
