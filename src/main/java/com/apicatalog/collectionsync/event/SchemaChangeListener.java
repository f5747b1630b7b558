package com.apicatalog.collectionsync.event;

import com.apicatalog.collectionsync.config.AsyncConfig;
import com.apicatalog.collectionsync.dto.ExtractionScope;
import com.apicatalog.collectionsync.dto.GenerationResult;
import com.apicatalog.collectionsync.dto.sync.SyncReport;
import com.apicatalog.collectionsync.exception.OwnerTypeNotFoundException;
import com.apicatalog.collectionsync.exception.SchemaIndexException;
import com.apicatalog.collectionsync.exception.SyncInProgressException;
import com.apicatalog.collectionsync.service.ApiCatalogService;
import com.apicatalog.collectionsync.service.ExclusionConfigurationService;
import com.apicatalog.collectionsync.service.schema.SchemaReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Regenerates an owner type's descriptors when its schema changes, then syncs the catalog
 * if auto-sync is on. The schema index is re-read first so the change itself is picked up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaChangeListener {

    private final ApiCatalogService catalogService;
    private final ExclusionConfigurationService exclusionConfigurationService;
    private final SchemaReader schemaReader;

    @Value("${catalog.sync.auto-sync:false}")
    private boolean autoSync;

    @Async(AsyncConfig.SCHEMA_CHANGE_EXECUTOR)
    @EventListener
    public void onSchemaChanged(SchemaChangedEvent event) {
        String ownerType = event.getOwnerType();
        if (exclusionConfigurationService.getExcludedOwnerTypes().contains(ownerType)) {
            log.debug("Ignoring schema change of excluded owner type {}", ownerType);
            return;
        }

        try {
            schemaReader.reload();
        } catch (SchemaIndexException e) {
            log.error("Schema change for {} not applied, index could not be re-read: {}", ownerType, e.getMessage());
            return;
        }

        try {
            GenerationResult result = catalogService.generate(ExtractionScope.singleType(ownerType));
            log.info("Auto-generated {} descriptors for {}", result.getDescriptorCount(), ownerType);

            if (autoSync) {
                SyncReport report = catalogService.synchronizeCatalog();
                log.info("Auto-sync after change of {} finished with {}", ownerType, report.getStatus());
            }
        } catch (OwnerTypeNotFoundException e) {
            log.warn("Schema change for unknown owner type {}: {}", ownerType, e.getMessage());
        } catch (SyncInProgressException e) {
            log.info("Auto-sync for {} skipped: {}", ownerType, e.getMessage());
        }
    }
}
