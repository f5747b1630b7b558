package com.apicatalog.collectionsync.event;

import lombok.Value;

/**
 * Published when an owner type's schema was saved in the registry.
 */
@Value
public class SchemaChangedEvent {
    String ownerType;
}
