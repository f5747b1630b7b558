package com.apicatalog.collectionsync.dto.schema;

/**
 * Surface a callable method was discovered on.
 */
public enum MethodSource {
    CONTROLLER,
    HOOK
}
