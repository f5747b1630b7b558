package com.apicatalog.collectionsync.dto.tree;

/**
 * How owner-type folders are arranged under the collection root.
 */
public enum Grouping {
    /** root / owner type / descriptors */
    FLAT_BY_TYPE,
    /** root / module / owner type / descriptors */
    BY_MODULE
}
