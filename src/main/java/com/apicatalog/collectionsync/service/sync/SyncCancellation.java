package com.apicatalog.collectionsync.service.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared by one sync run. Operations already dispatched finish; nothing new starts.
 */
public class SyncCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static SyncCancellation none() {
        return new SyncCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
