package com.apicatalog.collectionsync.dto.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What happened to one edit-script operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationOutcome {
    private DiffOpType type;
    private String path;
    private String nodeKind;        // FOLDER or LEAF
    private String remoteId;        // existing id, or the id assigned by a create
    private OutcomeStatus status;
    private ErrorKind errorKind;
    private String errorMessage;
    private int attempts;           // remote calls issued, retries included
}
