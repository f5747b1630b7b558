package com.apicatalog.collectionsync.exception;

/**
 * The remote collection tree could not be fetched, so there is nothing to diff against.
 */
public class RemoteFetchException extends RuntimeException {

    public RemoteFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
