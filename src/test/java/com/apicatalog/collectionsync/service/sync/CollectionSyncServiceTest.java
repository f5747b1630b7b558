package com.apicatalog.collectionsync.service.sync;

import com.apicatalog.collectionsync.dto.OwnerDescriptors;
import com.apicatalog.collectionsync.dto.schema.FieldSpec;
import com.apicatalog.collectionsync.dto.schema.MethodSpec;
import com.apicatalog.collectionsync.dto.sync.*;
import com.apicatalog.collectionsync.dto.tree.Grouping;
import com.apicatalog.collectionsync.dto.tree.TreeNode;
import com.apicatalog.collectionsync.exception.RemoteApplyException;
import com.apicatalog.collectionsync.exception.TransientRemoteException;
import com.apicatalog.collectionsync.service.descriptor.ContentHasher;
import com.apicatalog.collectionsync.service.descriptor.DescriptorPathGenerator;
import com.apicatalog.collectionsync.service.descriptor.EndpointDescriptorBuilder;
import com.apicatalog.collectionsync.service.tree.DescriptorTreeAssembler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class CollectionSyncServiceTest {

    private static final List<FieldSpec> INVOICE_FIELDS = List.of(
            FieldSpec.builder().name("amount").dataType("Currency").build(),
            FieldSpec.builder().name("customer").dataType("Link").build(),
            FieldSpec.builder().name("owner").dataType("Data").system(true).build());

    private static final MethodSpec CALCULATE_DISCOUNT = MethodSpec.builder()
            .ownerType("Invoice").name("calculate_discount").parameterName("discount_percent").build();

    private final EndpointDescriptorBuilder descriptorBuilder =
            new EndpointDescriptorBuilder(new DescriptorPathGenerator(), new ContentHasher());
    private final DescriptorTreeAssembler assembler = new DescriptorTreeAssembler();

    private InMemoryCollectionStore store;
    private List<Duration> sleeps;
    private ExecutorService pool;
    private CollectionSyncService syncService;

    @BeforeEach
    void setUp() {
        store = new InMemoryCollectionStore();
        sleeps = Collections.synchronizedList(new ArrayList<>());
        syncService = newSyncService(Runnable::run);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private CollectionSyncService newSyncService(java.util.concurrent.Executor executor) {
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(3)
                .initialBackoff(Duration.ofMillis(100))
                .maxBackoff(Duration.ofSeconds(1))
                .build();
        RemoteCallExecutor callExecutor = new RemoteCallExecutor(policy, sleeps::add);
        EditScriptApplier applier = new EditScriptApplier(store, callExecutor, executor);
        return new CollectionSyncService(store, new CollectionDiffService(new DescriptorPathGenerator()),
                applier, callExecutor);
    }

    private OwnerDescriptors owner(String ownerType, List<FieldSpec> fields, List<MethodSpec> methods) {
        return OwnerDescriptors.builder()
                .ownerType(ownerType)
                .moduleName("Accounts")
                .descriptors(descriptorBuilder.build(ownerType, fields, methods))
                .build();
    }

    private TreeNode canonical(OwnerDescriptors... owners) {
        return assembler.assemble(List.of(owners), Grouping.FLAT_BY_TYPE);
    }

    private SyncReport sync(TreeNode canonical) {
        return syncService.sync(canonical, Set.of("Invoice", "Customer"), SyncCancellation.none());
    }

    private static List<OperationOutcome> withStatus(SyncReport report, OutcomeStatus status) {
        List<OperationOutcome> matching = new ArrayList<>();
        for (OperationOutcome outcome : report.getOperations()) {
            if (outcome.getStatus() == status) {
                matching.add(outcome);
            }
        }
        return matching;
    }

    // ========================= FIRST AND REPEAT SYNC =========================

    @Test
    void firstSync_createsFolderBeforeItsLeaves() {
        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of(CALCULATE_DISCOUNT))));

        assertThat(report.getStatus()).isEqualTo(SyncStatus.SUCCEEDED);
        assertThat(report.getPhase()).isEqualTo(SyncPhase.DONE);
        assertThat(report.getPlannedByType()).containsEntry(DiffOpType.CREATE, 7);
        assertThat(report.getMutatingCalls()).isEqualTo(7);

        List<String> calls = store.calls();
        assertThat(calls.get(0)).isEqualTo("createFolder:Invoice");
        assertThat(calls.subList(1, calls.size())).containsExactly(
                "createRequest:Create Invoice",
                "createRequest:Delete Invoice",
                "createRequest:List Invoice",
                "createRequest:Retrieve Invoice",
                "createRequest:Update Invoice",
                "createRequest:calculate_discount");
        assertThat(store.findId("Invoice", "List Invoice")).isPresent();
    }

    @Test
    void repeatSync_isAllKeepWithZeroMutatingCalls() {
        TreeNode canonical = canonical(owner("Invoice", INVOICE_FIELDS, List.of(CALCULATE_DISCOUNT)));
        sync(canonical);
        store.clearCalls();

        SyncReport second = sync(canonical);

        assertThat(second.getStatus()).isEqualTo(SyncStatus.SUCCEEDED);
        assertThat(second.getPlannedByType()).containsEntry(DiffOpType.KEEP, 6)
                .containsEntry(DiffOpType.CREATE, 0)
                .containsEntry(DiffOpType.UPDATE, 0)
                .containsEntry(DiffOpType.DELETE, 0);
        assertThat(second.getOperations()).isEmpty();
        assertThat(second.getMutatingCalls()).isZero();
        assertThat(store.calls()).isEmpty();
    }

    @Test
    void changedBody_updatesOnlyTheAffectedLeaves() {
        sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));
        store.clearCalls();
        List<FieldSpec> withDueDate = new ArrayList<>(INVOICE_FIELDS);
        withDueDate.add(FieldSpec.builder().name("due_date").dataType("Date").build());

        SyncReport report = sync(canonical(owner("Invoice", withDueDate, List.of())));

        assertThat(store.calls()).containsExactly("updateRequest:Create Invoice", "updateRequest:Update Invoice");
        assertThat(report.getPlannedByType()).containsEntry(DiffOpType.UPDATE, 2).containsEntry(DiffOpType.KEEP, 3);
    }

    @Test
    void removedMethod_deletesItsStaleLeaf() {
        sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of(CALCULATE_DISCOUNT))));
        store.clearCalls();

        sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(store.calls()).containsExactly("deleteRequest:calculate_discount");
    }

    @Test
    void removedOwner_deletesLeavesBeforeTheFolder() {
        sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of()), owner("Customer", List.of(), List.of())));
        store.clearCalls();

        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        List<String> calls = store.calls();
        assertThat(calls).hasSize(6);
        assertThat(calls.subList(0, 5)).allMatch(call -> call.startsWith("deleteRequest:"));
        assertThat(calls.get(5)).isEqualTo("deleteFolder:Customer");
        assertThat(report.getStatus()).isEqualTo(SyncStatus.SUCCEEDED);
        assertThat(store.findId("Customer")).isEmpty();
    }

    // ========================= MANUAL CONTENT =========================

    @Test
    void handMadeContent_isIgnoredAndItsFolderKept() {
        String legacy = store.seedFolder(InMemoryCollectionStore.ROOT_ID, "LegacyStuff");
        store.seedRequest(legacy, "CustomPing", "GET", "/custom/ping");

        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(withStatus(report, OutcomeStatus.IGNORED))
                .extracting(OperationOutcome::getPath)
                .containsExactly("LegacyStuff/CustomPing");
        assertThat(store.calls()).noneMatch(call -> call.contains("LegacyStuff") || call.contains("CustomPing"));
        assertThat(store.findId("LegacyStuff", "CustomPing")).isPresent();
        assertThat(report.getStatus()).isEqualTo(SyncStatus.SUCCEEDED);
    }

    @Test
    void handMadeRequestInsideGeneratedFolder_survivesResync() {
        sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));
        store.seedRequest(store.findId("Invoice").orElseThrow(), "Smoke test", "GET", "/health");
        store.clearCalls();

        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(store.calls()).isEmpty();
        assertThat(withStatus(report, OutcomeStatus.IGNORED)).hasSize(1);
    }

    @Test
    void kindMismatch_isReportedAsConflictAndSkipped() {
        store.seedRequest(InMemoryCollectionStore.ROOT_ID, "Invoice", "GET", "/somewhere");

        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(withStatus(report, OutcomeStatus.CONFLICT)).singleElement()
                .satisfies(outcome -> assertThat(outcome.getErrorKind()).isEqualTo(ErrorKind.CONFLICT));
        assertThat(store.calls()).isEmpty();
        assertThat(report.getStatus()).isEqualTo(SyncStatus.SUCCEEDED);
    }

    // ========================= FAILURES =========================

    @Test
    void transientFailure_isRetriedWithBackoff() {
        store.failNext("createRequest:List Invoice", new TransientRemoteException("503 from upstream", null));

        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(report.getStatus()).isEqualTo(SyncStatus.SUCCEEDED);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100));
        assertThat(report.getMutatingCalls()).isEqualTo(7);
        assertThat(report.getOperations()).filteredOn(o -> o.getPath().equals("Invoice/List Invoice"))
                .singleElement()
                .satisfies(o -> assertThat(o.getAttempts()).isEqualTo(2));
    }

    @Test
    void rateLimit_waitsForTheServerHint() {
        store.failNext("createFolder:Invoice",
                new TransientRemoteException("429", Duration.ofSeconds(7), null));

        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(report.getStatus()).isEqualTo(SyncStatus.SUCCEEDED);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(7));
    }

    @Test
    void exhaustedRetries_failTheOpAndSkipTheRestOfItsFolder() {
        TransientRemoteException timeout = new TransientRemoteException("timeout", null);
        store.failNext("createRequest:List Invoice", timeout, timeout, timeout);

        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(report.getStatus()).isEqualTo(SyncStatus.PARTIALLY_SUCCEEDED);
        assertThat(report.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getPath()).isEqualTo("Invoice/List Invoice");
            assertThat(failure.getErrorKind()).isEqualTo(ErrorKind.TRANSIENT_REMOTE);
            assertThat(failure.getAttempts()).isEqualTo(3);
        });
        assertThat(withStatus(report, OutcomeStatus.SKIPPED)).extracting(OperationOutcome::getPath)
                .containsExactly("Invoice/Retrieve Invoice", "Invoice/Update Invoice");
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void rejectedFolder_abortsOnlyThatOwner() {
        store.failNext("createFolder:Customer", new RemoteApplyException("Validation failed", 400));

        SyncReport report = sync(canonical(
                owner("Customer", List.of(), List.of()), owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(report.getStatus()).isEqualTo(SyncStatus.PARTIALLY_SUCCEEDED);
        assertThat(report.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getPath()).isEqualTo("Customer");
            assertThat(failure.getErrorKind()).isEqualTo(ErrorKind.REMOTE_APPLY);
        });
        assertThat(withStatus(report, OutcomeStatus.SKIPPED)).hasSize(5)
                .allMatch(o -> o.getPath().startsWith("Customer/"));
        assertThat(store.findId("Invoice", "Update Invoice")).isPresent();
    }

    @Test
    void failedLeafDelete_keepsItsFolder() {
        sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of()), owner("Customer", List.of(), List.of())));
        store.failNext("deleteRequest:Create Customer", new RemoteApplyException("Server error", 500));
        store.clearCalls();

        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(report.getStatus()).isEqualTo(SyncStatus.PARTIALLY_SUCCEEDED);
        assertThat(store.calls()).doesNotContain("deleteFolder:Customer");
        assertThat(withStatus(report, OutcomeStatus.SKIPPED))
                .anyMatch(o -> o.getPath().equals("Customer") && o.getType() == DiffOpType.DELETE);
        assertThat(store.findId("Customer")).isPresent();
    }

    @Test
    void fetchFailure_endsFailedWithoutMutations() {
        store.failNext("fetchTree", new RemoteApplyException("Unauthorized", 401));

        SyncReport report = sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())));

        assertThat(report.getStatus()).isEqualTo(SyncStatus.FAILED);
        assertThat(report.getPhase()).isEqualTo(SyncPhase.FAILED);
        assertThat(report.getErrorKind()).isEqualTo(ErrorKind.REMOTE_FETCH);
        assertThat(report.getErrorMessage()).contains("Unauthorized");
        assertThat(store.calls()).isEmpty();
    }

    // ========================= CANCELLATION AND CONCURRENCY =========================

    @Test
    void cancellation_withNothingLeftToApply_isStillPartial() {
        TreeNode canonical = canonical(owner("Invoice", INVOICE_FIELDS, List.of(CALCULATE_DISCOUNT)));
        sync(canonical);
        store.clearCalls();
        SyncCancellation cancellation = new SyncCancellation();
        cancellation.cancel();

        SyncReport report = syncService.sync(canonical, Set.of("Invoice"), cancellation);

        assertThat(report.isCancelled()).isTrue();
        assertThat(report.getStatus()).isEqualTo(SyncStatus.PARTIALLY_SUCCEEDED);
        assertThat(report.getFailures()).isEmpty();
        assertThat(report.getOutcomesByStatus()).containsEntry(OutcomeStatus.KEPT, 6);
        assertThat(store.calls()).isEmpty();
    }

    @Test
    void cancellation_stopsDispatchingNewOps() {
        SyncCancellation cancellation = new SyncCancellation();
        store.onMutation(call -> cancellation.cancel());

        SyncReport report = syncService.sync(canonical(owner("Invoice", INVOICE_FIELDS, List.of())),
                Set.of(), cancellation);

        assertThat(report.isCancelled()).isTrue();
        assertThat(report.getStatus()).isEqualTo(SyncStatus.PARTIALLY_SUCCEEDED);
        assertThat(store.calls()).containsExactly("createFolder:Invoice");
        assertThat(withStatus(report, OutcomeStatus.APPLIED)).hasSize(1);
        assertThat(withStatus(report, OutcomeStatus.NOT_ATTEMPTED)).hasSize(5)
                .allMatch(o -> o.getErrorKind() == ErrorKind.CANCELLED);
    }

    @Test
    void parallelApply_convergesToTheSameTree() {
        pool = Executors.newFixedThreadPool(3);
        syncService = newSyncService(pool);
        TreeNode canonical = canonical(
                owner("Customer", List.of(), List.of()),
                owner("Invoice", INVOICE_FIELDS, List.of(CALCULATE_DISCOUNT)),
                owner("Payment Entry", List.of(), List.of()));

        SyncReport first = sync(canonical);
        store.clearCalls();
        SyncReport second = sync(canonical);

        assertThat(first.getStatus()).isEqualTo(SyncStatus.SUCCEEDED);
        assertThat(store.nodeCount()).isEqualTo(3 + 5 + 6 + 5);
        assertThat(second.getPlannedByType()).containsEntry(DiffOpType.KEEP, 16);
        assertThat(store.calls()).isEmpty();
    }
}
