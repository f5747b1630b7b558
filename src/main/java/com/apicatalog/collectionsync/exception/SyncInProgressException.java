package com.apicatalog.collectionsync.exception;

public class SyncInProgressException extends RuntimeException {

    public SyncInProgressException() {
        super("A sync run is already in progress");
    }
}
