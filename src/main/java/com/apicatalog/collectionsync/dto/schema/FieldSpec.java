package com.apicatalog.collectionsync.dto.schema;

import lombok.Builder;
import lombok.Value;

/**
 * One field of a record type as reported by the schema registry.
 * System and auditable fields stay in the list for reference but never reach a request body.
 */
@Value
@Builder
public class FieldSpec {
    String name;
    String dataType;
    boolean system;
    boolean auditable;
}
