package com.apicatalog.collectionsync.dto.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A discovered callable entry point. Identity is {@code (ownerType, name)}.
 */
@Value
@Builder
public class MethodSpec {
    String ownerType;
    String name;
    @Singular
    List<String> parameterNames;
    String sourceLocation;
    MethodSource source;

    public String key() {
        return ownerType + "::" + name;
    }
}
