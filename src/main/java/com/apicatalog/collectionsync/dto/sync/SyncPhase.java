package com.apicatalog.collectionsync.dto.sync;

public enum SyncPhase {
    FETCHING,
    DIFFING,
    APPLYING,
    DONE,
    FAILED
}
