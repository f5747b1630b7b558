package com.apicatalog.collectionsync.service.sync;

import com.apicatalog.collectionsync.exception.RemoteApplyException;
import com.apicatalog.collectionsync.exception.RetriesExhaustedException;
import com.apicatalog.collectionsync.exception.TransientRemoteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs remote calls with retry on transient failures.
 *
 * A rate-limit hint from the server replaces the computed backoff for that wait. Any other failure
 * is rethrown at once.
 */
@Component
@Slf4j
public class RemoteCallExecutor {

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    @Autowired
    public RemoteCallExecutor(RetryPolicy retryPolicy) {
        this(retryPolicy, Sleeper.THREAD);
    }

    public RemoteCallExecutor(RetryPolicy retryPolicy, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public <T> T execute(String description, Supplier<T> call) {
        int maxAttempts = Math.max(1, retryPolicy.getMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientRemoteException e) {
                if (attempt >= maxAttempts) {
                    log.error("[Collection Store] {} failed after {} attempts: {}", description, attempt, e.getMessage());
                    throw new RetriesExhaustedException(
                            description + " failed after " + attempt + " attempts: " + e.getMessage(), attempt, e);
                }
                int failedAttempt = attempt;
                Duration wait = e.getRetryAfter().orElseGet(() -> retryPolicy.backoffAfter(failedAttempt));
                log.warn("[Collection Store] {} failed (attempt {}/{}), retrying in {}ms: {}",
                        description, attempt, maxAttempts, wait.toMillis(), e.getMessage());
                pause(description, wait);
            }
        }
    }

    public void run(String description, Runnable call) {
        execute(description, () -> {
            call.run();
            return null;
        });
    }

    private void pause(String description, Duration wait) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RemoteApplyException("Interrupted during retry of " + description, 0, ie);
        }
    }
}
