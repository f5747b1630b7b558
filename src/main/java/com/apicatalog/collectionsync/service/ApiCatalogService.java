package com.apicatalog.collectionsync.service;

import com.apicatalog.collectionsync.dto.CatalogBuild;
import com.apicatalog.collectionsync.dto.ExtractionScope;
import com.apicatalog.collectionsync.dto.GenerationResult;
import com.apicatalog.collectionsync.dto.sync.SyncReport;
import com.apicatalog.collectionsync.dto.tree.Grouping;
import com.apicatalog.collectionsync.dto.tree.TreeNode;
import com.apicatalog.collectionsync.exception.SyncInProgressException;
import com.apicatalog.collectionsync.model.SyncRunRecord;
import com.apicatalog.collectionsync.repository.SyncRunRecordRepository;
import com.apicatalog.collectionsync.service.remote.CollectionStoreClient;
import com.apicatalog.collectionsync.service.schema.SchemaReader;
import com.apicatalog.collectionsync.service.sync.CollectionSyncService;
import com.apicatalog.collectionsync.service.sync.SyncCancellation;
import com.apicatalog.collectionsync.service.tree.DescriptorTreeAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for in-process and HTTP callers: generate, then assemble and sync the catalog.
 *
 * The catalog synced is always the union of all active generator records, so syncing after a
 * single-type generation never removes other types' requests. One sync runs at a time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ApiCatalogService {

    private final ApiGeneratorService generatorService;
    private final DescriptorTreeAssembler treeAssembler;
    private final CollectionSyncService collectionSyncService;
    private final CollectionStoreClient collectionStoreClient;
    private final SchemaReader schemaReader;
    private final SyncRunRecordRepository syncRunRecordRepository;

    @Value("${catalog.generation.grouping:FLAT_BY_TYPE}")
    private Grouping grouping;

    private final ReentrantLock syncLock = new ReentrantLock();
    private final Set<SyncCancellation> activeRuns = ConcurrentHashMap.newKeySet();

    public GenerationResult generate(ExtractionScope scope) {
        return generatorService.generate(scope);
    }

    /**
     * Generate for the scope, then sync the whole catalog.
     */
    public SyncReport generateAndSync(ExtractionScope scope) {
        GenerationResult generation = generatorService.generate(scope);
        log.info("Generated {} descriptors for {} before sync", generation.getDescriptorCount(), scope.describe());
        return synchronize(scope.describe());
    }

    public SyncReport synchronizeCatalog() {
        return synchronize("CATALOG");
    }

    /**
     * Cancel every run in progress.
     *
     * @return number of runs signalled
     */
    public int cancelActiveRuns() {
        activeRuns.forEach(SyncCancellation::cancel);
        log.info("Cancellation requested for {} active sync runs", activeRuns.size());
        return activeRuns.size();
    }

    public List<SyncRunRecord> recentRuns() {
        return syncRunRecordRepository.findTop20ByOrderByStartedAtDesc();
    }

    public Optional<SyncRunRecord> lastRun() {
        return syncRunRecordRepository.findFirstByOrderByStartedAtDesc();
    }

    public boolean testConnection() {
        return collectionStoreClient.testConnection();
    }

    /**
     * Create the remote environment the synced requests resolve their base URL from.
     *
     * @return remote environment id
     */
    public String createEnvironment() {
        String environmentId = collectionStoreClient.createEnvironment();
        log.info("Created remote environment {}", environmentId);
        return environmentId;
    }

    // ========================= SYNC =========================

    private SyncReport synchronize(String trigger) {
        if (!syncLock.tryLock()) {
            throw new SyncInProgressException();
        }
        SyncCancellation cancellation = new SyncCancellation();
        activeRuns.add(cancellation);
        try {
            CatalogBuild catalog = generatorService.buildCatalog();
            TreeNode canonicalRoot = treeAssembler.assemble(catalog.getOwners(), grouping);

            Set<String> knownOwnerTypes = new HashSet<>(schemaReader.listTypes(null));
            knownOwnerTypes.addAll(catalog.getCoveredOwnerTypes());

            SyncReport report = collectionSyncService.sync(canonicalRoot, knownOwnerTypes, cancellation);
            if (!catalog.getFailures().isEmpty()) {
                log.warn("Sync {} ran without {} owner types that failed to generate",
                        report.getRunId(), catalog.getFailures().size());
            }
            syncRunRecordRepository.save(SyncRunRecord.from(report, trigger));
            return report;
        } finally {
            activeRuns.remove(cancellation);
            syncLock.unlock();
        }
    }
}
