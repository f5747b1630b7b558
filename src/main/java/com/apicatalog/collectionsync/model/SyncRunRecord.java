package com.apicatalog.collectionsync.model;

import com.apicatalog.collectionsync.dto.sync.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "sync_runs")
public class SyncRunRecord {

    @Id
    private String id;

    private String scope;

    private SyncStatus status;

    private SyncPhase phase;

    private boolean cancelled;

    @Indexed
    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    @Builder.Default
    private Map<String, Integer> plannedByType = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> outcomesByStatus = new LinkedHashMap<>();

    @Builder.Default
    private List<OperationOutcome> failures = new ArrayList<>();

    private int mutatingCalls;

    private String errorMessage;

    public static SyncRunRecord from(SyncReport report, String scope) {
        Map<String, Integer> planned = new LinkedHashMap<>();
        report.getPlannedByType().forEach((type, count) -> planned.put(type.name(), count));
        Map<String, Integer> outcomes = new LinkedHashMap<>();
        report.getOutcomesByStatus().forEach((status, count) -> outcomes.put(status.name(), count));

        return SyncRunRecord.builder()
                .id(report.getRunId())
                .scope(scope)
                .status(report.getStatus())
                .phase(report.getPhase())
                .cancelled(report.isCancelled())
                .startedAt(report.getStartedAt())
                .finishedAt(report.getFinishedAt())
                .plannedByType(planned)
                .outcomesByStatus(outcomes)
                .failures(new ArrayList<>(report.getFailures()))
                .mutatingCalls(report.getMutatingCalls())
                .errorMessage(report.getErrorMessage())
                .build();
    }
}
