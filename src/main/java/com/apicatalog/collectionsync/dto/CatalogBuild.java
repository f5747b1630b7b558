package com.apicatalog.collectionsync.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Descriptors of every owner covered by the active generator records, ready to assemble.
 */
@Value
@Builder
public class CatalogBuild {
    List<OwnerDescriptors> owners;
    List<ExtractionFailure> failures;
    Set<String> coveredOwnerTypes;  // owners of every record, failed ones included
}
