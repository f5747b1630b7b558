package com.apicatalog.collectionsync.dto;

import com.apicatalog.collectionsync.dto.schema.FieldSpec;
import com.apicatalog.collectionsync.dto.schema.MethodSpec;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Extraction output for one owner type: its fields in declaration order and its de-duplicated methods.
 */
@Value
@Builder
public class OwnerMetadata {
    String ownerType;
    String moduleName;
    List<FieldSpec> fields;
    List<MethodSpec> methods;
}
