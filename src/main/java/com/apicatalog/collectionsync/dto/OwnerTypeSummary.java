package com.apicatalog.collectionsync.dto;

import com.apicatalog.collectionsync.model.GeneratorRecord;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A generatable owner type and the latest generator record covering it, if any.
 */
@Value
@Builder
public class OwnerTypeSummary {
    String ownerType;
    String moduleName;
    boolean hasGenerator;
    GeneratorRecord.Status status;
    int endpointCount;
    LocalDateTime lastGeneratedAt;
}
