package com.apicatalog.collectionsync.exception;

/**
 * A transient failure persisted through every allowed attempt.
 */
public class RetriesExhaustedException extends RemoteApplyException {

    private final int attempts;

    public RetriesExhaustedException(String message, int attempts, TransientRemoteException lastFailure) {
        super(message, 0, lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
