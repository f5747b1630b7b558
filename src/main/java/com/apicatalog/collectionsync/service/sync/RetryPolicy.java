package com.apicatalog.collectionsync.service.sync;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff with a ceiling on attempts and on a single wait.
 */
@Value
@Builder
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 5;

    @Builder.Default
    Duration initialBackoff = Duration.ofMillis(500);

    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(30);

    /**
     * Wait before the attempt following {@code failedAttempt} (1-based): initial, 2x, 4x ... capped at max.
     */
    public Duration backoffAfter(int failedAttempt) {
        long initial = initialBackoff.toMillis();
        long cap = maxBackoff.toMillis();
        int shift = Math.min(failedAttempt - 1, 30);
        long delay = initial * (1L << shift);
        if (delay < 0 || delay > cap) {
            delay = cap;
        }
        return Duration.ofMillis(delay);
    }

    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().maxAttempts(1).initialBackoff(Duration.ZERO).maxBackoff(Duration.ZERO).build();
    }
}
