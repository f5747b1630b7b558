package com.apicatalog.collectionsync.service.sync;

import com.apicatalog.collectionsync.dto.sync.*;
import com.apicatalog.collectionsync.dto.tree.TreeNode;
import com.apicatalog.collectionsync.exception.RemoteApplyException;
import com.apicatalog.collectionsync.exception.RetriesExhaustedException;
import com.apicatalog.collectionsync.service.remote.CollectionStoreClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Applies an edit script to the remote store.
 *
 * Top-level subtrees touch disjoint remote nodes, so each runs as its own task on the sync executor
 * while the ops inside a subtree run in script order. A failed op aborts the rest of its subtree:
 * a failed folder op aborts everything under that folder, a failed request op aborts the rest of
 * its folder. Deleting a folder is skipped whenever anything below it failed.
 */
@Component
@Slf4j
public class EditScriptApplier {

    private final CollectionStoreClient client;
    private final RemoteCallExecutor callExecutor;
    private final Executor syncExecutor;

    public EditScriptApplier(CollectionStoreClient client,
                             RemoteCallExecutor callExecutor,
                             @Qualifier("syncExecutor") Executor syncExecutor) {
        this.client = client;
        this.callExecutor = callExecutor;
        this.syncExecutor = syncExecutor;
    }

    /**
     * @param rootRemoteId remote id of the collection root, used for ops created directly under it
     * @return one outcome per op, in script order
     */
    public List<OperationOutcome> apply(EditScript script, String rootRemoteId, SyncCancellation cancellation) {
        Map<String, List<DiffOp>> partitions = script.partitionByTopLevel();
        log.info("Applying {} ops across {} subtrees", script.getOps().size(), partitions.size());

        Map<DiffOp, OperationOutcome> outcomes = new IdentityHashMap<>();
        List<CompletableFuture<List<OperationOutcome>>> futures = new ArrayList<>();
        List<List<DiffOp>> dispatched = new ArrayList<>();

        for (List<DiffOp> partition : partitions.values()) {
            dispatched.add(partition);
            futures.add(CompletableFuture.supplyAsync(
                    () -> applyPartition(partition, rootRemoteId, cancellation), syncExecutor));
        }

        for (int i = 0; i < futures.size(); i++) {
            List<DiffOp> partition = dispatched.get(i);
            List<OperationOutcome> partitionOutcomes = futures.get(i).join();
            for (int j = 0; j < partition.size(); j++) {
                outcomes.put(partition.get(j), partitionOutcomes.get(j));
            }
        }

        List<OperationOutcome> ordered = new ArrayList<>(script.getOps().size());
        for (DiffOp op : script.getOps()) {
            ordered.add(outcomes.get(op));
        }
        return ordered;
    }

    // ========================= PARTITION =========================

    private List<OperationOutcome> applyPartition(List<DiffOp> ops, String rootRemoteId, SyncCancellation cancellation) {
        List<OperationOutcome> outcomes = new ArrayList<>(ops.size());
        Map<List<String>, String> createdIds = new HashMap<>();
        List<List<String>> abortedPaths = new ArrayList<>();

        for (DiffOp op : ops) {
            if (op.getType().isMutating() && cancellation.isCancelled()) {
                outcomes.add(outcome(op, OutcomeStatus.NOT_ATTEMPTED, null)
                        .errorKind(ErrorKind.CANCELLED)
                        .errorMessage("sync cancelled before dispatch")
                        .build());
                continue;
            }
            Optional<List<String>> blockedBy = blockedBy(op, abortedPaths);
            if (blockedBy.isPresent()) {
                outcomes.add(outcome(op, OutcomeStatus.SKIPPED, op.getRemoteId())
                        .errorKind(ErrorKind.SUBTREE_ABORTED)
                        .errorMessage("earlier failure under '" + String.join("/", blockedBy.get()) + "'")
                        .build());
                continue;
            }

            OperationOutcome result = applyOne(op, rootRemoteId, createdIds);
            if (result.getStatus() == OutcomeStatus.FAILED) {
                abortedPaths.add(abortScope(op));
            }
            outcomes.add(result);
        }
        return outcomes;
    }

    private OperationOutcome applyOne(DiffOp op, String rootRemoteId, Map<List<String>, String> createdIds) {
        switch (op.getType()) {
            case KEEP:
                return outcome(op, OutcomeStatus.KEPT, op.getRemoteId()).build();
            case IGNORED:
                return outcome(op, OutcomeStatus.IGNORED, op.getRemoteId()).errorMessage(op.getDetail()).build();
            case CONFLICT:
                return outcome(op, OutcomeStatus.CONFLICT, op.getRemoteId())
                        .errorKind(ErrorKind.CONFLICT)
                        .errorMessage(op.getDetail())
                        .build();
            default:
                break;
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            String remoteId = mutate(op, rootRemoteId, createdIds, attempts);
            log.debug("{} '{}' applied", op.getType(), op.pathString());
            return outcome(op, OutcomeStatus.APPLIED, remoteId).attempts(attempts.get()).build();
        } catch (RetriesExhaustedException e) {
            log.error("{} '{}' gave up after retries: {}", op.getType(), op.pathString(), e.getMessage());
            return failed(op, ErrorKind.TRANSIENT_REMOTE, e.getMessage(), attempts.get());
        } catch (RemoteApplyException e) {
            ErrorKind kind = e.getStatusCode() == 404 ? ErrorKind.NOT_FOUND : ErrorKind.REMOTE_APPLY;
            log.error("{} '{}' rejected: {}", op.getType(), op.pathString(), e.getMessage());
            return failed(op, kind, e.getMessage(), attempts.get());
        } catch (RuntimeException e) {
            log.error("{} '{}' failed unexpectedly", op.getType(), op.pathString(), e);
            return failed(op, ErrorKind.INTERNAL, e.getMessage(), attempts.get());
        }
    }

    private String mutate(DiffOp op, String rootRemoteId, Map<List<String>, String> createdIds, AtomicInteger attempts) {
        TreeNode node = op.getNode();
        String description = op.getType() + " '" + op.pathString() + "'";

        switch (op.getType()) {
            case CREATE: {
                String parentId = resolveParent(op, rootRemoteId, createdIds);
                String id = node.isFolder()
                        ? call(description, () -> client.createFolder(parentId, node.getName()), attempts)
                        : call(description, () -> client.createRequest(parentId, node.getDescriptor()), attempts);
                createdIds.put(op.getPath(), id);
                return id;
            }
            case UPDATE:
                call(description, () -> {
                    client.updateRequest(op.getRemoteId(), node.getDescriptor());
                    return null;
                }, attempts);
                return op.getRemoteId();
            case DELETE:
                call(description, () -> {
                    if (node.isFolder()) {
                        client.deleteFolder(op.getRemoteId());
                    } else {
                        client.deleteRequest(op.getRemoteId());
                    }
                    return null;
                }, attempts);
                return op.getRemoteId();
            default:
                throw new IllegalStateException("Not a mutating op: " + op.getType());
        }
    }

    private <T> T call(String description, Supplier<T> remoteCall, AtomicInteger attempts) {
        return callExecutor.execute(description, () -> {
            attempts.incrementAndGet();
            return remoteCall.get();
        });
    }

    private String resolveParent(DiffOp op, String rootRemoteId, Map<List<String>, String> createdIds) {
        if (op.getParentRemoteId() != null) {
            return op.getParentRemoteId();
        }
        List<String> parentPath = op.parentPath();
        if (parentPath.isEmpty()) {
            return rootRemoteId;
        }
        String id = createdIds.get(parentPath);
        if (id == null) {
            throw new IllegalStateException("Parent of '" + op.pathString() + "' was not created");
        }
        return id;
    }

    // ========================= SUBTREE ABORT =========================

    private static List<String> abortScope(DiffOp op) {
        if (op.isFolderOp() || op.getPath().size() == 1) {
            return op.getPath();
        }
        return op.parentPath();
    }

    private static Optional<List<String>> blockedBy(DiffOp op, List<List<String>> abortedPaths) {
        for (List<String> aborted : abortedPaths) {
            if (startsWith(op.getPath(), aborted)) {
                return Optional.of(aborted);
            }
            if (op.getType() == DiffOpType.DELETE && op.isFolderOp() && startsWith(aborted, op.getPath())) {
                return Optional.of(aborted);
            }
        }
        return Optional.empty();
    }

    private static boolean startsWith(List<String> path, List<String> prefix) {
        return path.size() >= prefix.size() && path.subList(0, prefix.size()).equals(prefix);
    }

    // ========================= OUTCOMES =========================

    private static OperationOutcome.OperationOutcomeBuilder outcome(DiffOp op, OutcomeStatus status, String remoteId) {
        return OperationOutcome.builder()
                .type(op.getType())
                .path(op.pathString())
                .nodeKind(op.getNode() != null ? op.getNode().getKind().name() : null)
                .remoteId(remoteId)
                .status(status);
    }

    private static OperationOutcome failed(DiffOp op, ErrorKind kind, String message, int attempts) {
        return outcome(op, OutcomeStatus.FAILED, op.getRemoteId())
                .errorKind(kind)
                .errorMessage(message)
                .attempts(attempts)
                .build();
    }
}
