package com.apicatalog.collectionsync.service.sync;

import com.apicatalog.collectionsync.dto.sync.*;
import com.apicatalog.collectionsync.dto.tree.TreeNode;
import com.apicatalog.collectionsync.exception.RemoteFetchException;
import com.apicatalog.collectionsync.service.remote.CollectionStoreClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Drives one sync run: fetch the remote tree, diff it against the canonical tree, apply the script.
 *
 * Phases move FETCHING, DIFFING, APPLYING, then DONE. A fetch failure ends the run in FAILED
 * before any mutation. Once applying starts, the run always produces a report, whatever the
 * individual operations did.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CollectionSyncService {

    private final CollectionStoreClient client;
    private final CollectionDiffService diffService;
    private final EditScriptApplier applier;
    private final RemoteCallExecutor callExecutor;

    public SyncReport sync(TreeNode canonicalRoot) {
        return sync(canonicalRoot, Collections.emptySet(), SyncCancellation.none());
    }

    /**
     * @param knownOwnerTypes owner types whose generated requests may be removed when no longer canonical
     */
    public SyncReport sync(TreeNode canonicalRoot, Set<String> knownOwnerTypes, SyncCancellation cancellation) {
        SyncReport report = SyncReport.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now())
                .phase(SyncPhase.FETCHING)
                .build();
        log.info("Sync {} started ({} canonical nodes)", report.getRunId(), canonicalRoot.size());

        // ========================= FETCHING =========================
        TreeNode remoteRoot;
        try {
            remoteRoot = fetchRemoteTree();
        } catch (RemoteFetchException e) {
            log.error("Sync {} failed while fetching the remote tree: {}", report.getRunId(), e.getMessage());
            return finishFailed(report, ErrorKind.REMOTE_FETCH, e.getMessage());
        }

        // ========================= DIFFING =========================
        report.setPhase(SyncPhase.DIFFING);
        EditScript script = diffService.diff(canonicalRoot, remoteRoot, knownOwnerTypes);
        report.setPlannedByType(script.countByType());

        // ========================= APPLYING =========================
        report.setPhase(SyncPhase.APPLYING);
        List<OperationOutcome> outcomes = applier.apply(script, remoteRoot.getRemoteId(), cancellation);

        report.setPhase(SyncPhase.DONE);
        report.setCancelled(cancellation.isCancelled());
        summarize(report, outcomes);
        report.setFinishedAt(LocalDateTime.now());

        log.info("Sync {} finished: status={}, planned={}, outcomes={}, mutating calls={}",
                report.getRunId(), report.getStatus(), report.getPlannedByType(),
                report.getOutcomesByStatus(), report.getMutatingCalls());
        return report;
    }

    private TreeNode fetchRemoteTree() {
        try {
            return callExecutor.execute("fetch collection tree", client::fetchTree);
        } catch (RemoteFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteFetchException("Could not fetch remote collection: " + e.getMessage(), e);
        }
    }

    // ========================= REPORT =========================

    private void summarize(SyncReport report, List<OperationOutcome> outcomes) {
        Map<OutcomeStatus, Integer> byStatus = new EnumMap<>(OutcomeStatus.class);
        for (OutcomeStatus status : OutcomeStatus.values()) {
            byStatus.put(status, 0);
        }

        List<OperationOutcome> listed = new ArrayList<>();
        List<OperationOutcome> failures = new ArrayList<>();
        int mutatingCalls = 0;

        for (OperationOutcome outcome : outcomes) {
            byStatus.merge(outcome.getStatus(), 1, Integer::sum);
            mutatingCalls += outcome.getAttempts();
            if (outcome.getStatus() != OutcomeStatus.KEPT) {
                listed.add(outcome);
            }
            if (outcome.getStatus() == OutcomeStatus.FAILED) {
                failures.add(outcome);
            }
        }

        report.setOutcomesByStatus(byStatus);
        report.setOperations(listed);
        report.setFailures(failures);
        report.setMutatingCalls(mutatingCalls);

        boolean incomplete = report.isCancelled()
                || !failures.isEmpty()
                || byStatus.get(OutcomeStatus.SKIPPED) > 0
                || byStatus.get(OutcomeStatus.NOT_ATTEMPTED) > 0;
        report.setStatus(incomplete ? SyncStatus.PARTIALLY_SUCCEEDED : SyncStatus.SUCCEEDED);
    }

    private SyncReport finishFailed(SyncReport report, ErrorKind kind, String message) {
        report.setPhase(SyncPhase.FAILED);
        report.setStatus(SyncStatus.FAILED);
        report.setErrorKind(kind);
        report.setErrorMessage(message);
        report.setFinishedAt(LocalDateTime.now());
        return report;
    }
}
