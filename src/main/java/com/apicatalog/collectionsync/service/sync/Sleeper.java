package com.apicatalog.collectionsync.service.sync;

import java.time.Duration;

/**
 * Pause between retry attempts. Replaced in tests to record waits without sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
