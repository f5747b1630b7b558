package com.apicatalog.collectionsync.exception;

/**
 * The remote collection store rejected a call (auth, validation, missing node),
 * or a transient failure outlived the retry ceiling.
 */
public class RemoteApplyException extends RuntimeException {

    private final int statusCode;

    public RemoteApplyException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteApplyException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the rejection, or 0 when the failure was not an HTTP response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
