package com.apicatalog.collectionsync.dto.sync;

public enum SyncStatus {
    SUCCEEDED,
    PARTIALLY_SUCCEEDED,
    FAILED
}
