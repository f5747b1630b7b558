package com.apicatalog.collectionsync.dto.tree;

public enum NodeKind {
    FOLDER,
    LEAF
}
