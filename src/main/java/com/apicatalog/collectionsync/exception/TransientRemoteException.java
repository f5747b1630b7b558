package com.apicatalog.collectionsync.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * A remote call failed in a way that may succeed on retry: timeout, rate limit or an unavailable upstream.
 * A rate-limit response carries the server's retry-after hint.
 */
public class TransientRemoteException extends RuntimeException {

    private final Duration retryAfter;

    public TransientRemoteException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TransientRemoteException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
