package com.apicatalog.collectionsync.dto;

public enum DescriptorKind {
    LIST,
    RETRIEVE,
    CREATE,
    UPDATE,
    DELETE,
    METHOD
}
