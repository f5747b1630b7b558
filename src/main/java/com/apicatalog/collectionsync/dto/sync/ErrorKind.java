package com.apicatalog.collectionsync.dto.sync;

public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    TRANSIENT_REMOTE,
    REMOTE_APPLY,
    REMOTE_FETCH,
    SUBTREE_ABORTED,
    CANCELLED,
    INTERNAL
}
