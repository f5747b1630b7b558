package com.apicatalog.collectionsync.dto.sync;

public enum DiffOpType {
    CREATE,
    UPDATE,
    DELETE,
    KEEP,
    IGNORED,    // remote-only content that does not follow the naming convention
    CONFLICT;   // folder on one side, leaf on the other

    public boolean isMutating() {
        return this == CREATE || this == UPDATE || this == DELETE;
    }
}
