package com.apicatalog.collectionsync.dto.sync;

public enum OutcomeStatus {
    APPLIED,
    KEPT,
    IGNORED,
    CONFLICT,
    FAILED,
    SKIPPED,        // an earlier failure aborted this subtree
    NOT_ATTEMPTED   // the run was cancelled first
}
