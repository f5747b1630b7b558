package com.apicatalog.collectionsync.exception;

/**
 * The schema index could not be read or parsed.
 */
public class SchemaIndexException extends RuntimeException {

    public SchemaIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
