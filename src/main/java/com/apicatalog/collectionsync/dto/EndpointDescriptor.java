package com.apicatalog.collectionsync.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One generated API endpoint. Two descriptors are equivalent iff their content hashes match;
 * the hash covers verb, path template and example body, not the name or description.
 */
@Value
@Builder(toBuilder = true)
public class EndpointDescriptor {
    String name;                        // leaf name in the collection, unique per owner folder
    String ownerType;
    DescriptorKind kind;
    String verb;
    String pathTemplate;
    String description;
    Map<String, Object> exampleBody;    // null for bodiless verbs
    String contentHash;
}
