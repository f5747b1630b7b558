package com.apicatalog.collectionsync.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Descriptors generated for one owner type, with the module it belongs to.
 */
@Value
@Builder
public class OwnerDescriptors {
    String ownerType;
    String moduleName;
    List<EndpointDescriptor> descriptors;
}
