package com.apicatalog.collectionsync.exception;

/**
 * The requested owner type is not known to the schema registry.
 */
public class OwnerTypeNotFoundException extends RuntimeException {

    private final String ownerType;

    public OwnerTypeNotFoundException(String ownerType) {
        super("Owner type not found: " + ownerType);
        this.ownerType = ownerType;
    }

    protected OwnerTypeNotFoundException(String ownerType, String message) {
        super(message);
        this.ownerType = ownerType;
    }

    public String getOwnerType() {
        return ownerType;
    }
}
