package com.sandstormtracker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Map;

// ========== Dead Letter Queue Service ==========
// Mutations that failed after retry, kept for manual reconciliation.
@Service
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    static final String COLLECTION = "dead_letter_queue";

    private final MongoTemplate mongoTemplate;

    public void logFailedMutation(String operation, String serverId, String error) {
        log.error("Dropped store mutation: operation={}, server={}, error={}", operation, serverId, error);

        try {
            mongoTemplate.save(Map.of(
                "operation", operation,
                "serverId", serverId,
                "error", error == null ? "unknown" : error,
                "failedAt", LocalDateTime.now(),
                "resolved", false
            ), COLLECTION);
        } catch (Exception e) {
            // the store is the thing failing; the log line above is all that is left
            log.error("CRITICAL: Failed to write to DLQ for server {}", serverId, e);
        }
    }
}
