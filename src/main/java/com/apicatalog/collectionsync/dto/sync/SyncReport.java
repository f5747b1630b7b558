package com.apicatalog.collectionsync.dto.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one sync run. Lists every operation other than KEEP with its outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncReport {
    private String runId;
    private SyncStatus status;
    private SyncPhase phase;
    private boolean cancelled;

    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;

    // Planned operations per kind
    @Builder.Default
    private Map<DiffOpType, Integer> plannedByType = new EnumMap<>(DiffOpType.class);

    // Outcomes per status
    @Builder.Default
    private Map<OutcomeStatus, Integer> outcomesByStatus = new EnumMap<>(OutcomeStatus.class);

    @Builder.Default
    private List<OperationOutcome> operations = new ArrayList<>();

    @Builder.Default
    private List<OperationOutcome> failures = new ArrayList<>();

    private int mutatingCalls;

    // Set when the run could not get past FETCHING
    private ErrorKind errorKind;
    private String errorMessage;
}
