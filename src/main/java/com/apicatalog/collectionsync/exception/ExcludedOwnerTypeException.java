package com.apicatalog.collectionsync.exception;

/**
 * The owner type exists but is on the excluded owner-type list, so no descriptors are generated for it.
 */
public class ExcludedOwnerTypeException extends OwnerTypeNotFoundException {

    public ExcludedOwnerTypeException(String ownerType) {
        super(ownerType, "Owner type is excluded from generation: " + ownerType);
    }
}
