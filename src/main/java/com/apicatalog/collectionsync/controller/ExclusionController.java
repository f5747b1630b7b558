package com.apicatalog.collectionsync.controller;

import com.apicatalog.collectionsync.model.ExclusionConfiguration;
import com.apicatalog.collectionsync.service.ExclusionConfigurationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * The three lists that shape what generation produces:
 * <ul>
 *   <li>{@code EXCLUDED_FIELD_NAMES}: fields left out of Create and Update example bodies</li>
 *   <li>{@code EXCLUDED_FIELD_TYPES}: layout field types dropped before bodies are built</li>
 *   <li>{@code EXCLUDED_OWNER_TYPES}: owner types skipped by module and full scans, and rejected
 *       with 422 when requested on their own</li>
 * </ul>
 * Edits apply to the next generation. Requests already synced change on the next sync after it.
 * Any other list name is a 400.
 */
@RestController
@RequestMapping("/api/exclusions")
@Slf4j
@RequiredArgsConstructor
public class ExclusionController {

    private final ExclusionConfigurationService configService;

    @GetMapping
    public ResponseEntity<List<ExclusionConfiguration>> getAllConfigurations() {
        return ResponseEntity.ok(configService.getAllActiveConfigurations());
    }

    /**
     * The active list, or 404 when it was deactivated and nothing is excluded by it
     */
    @GetMapping("/{configType}")
    public ResponseEntity<ExclusionConfiguration> getConfiguration(@PathVariable String configType) {
        return configService.getConfigurationByType(configType)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Replace a list's values or description. Requests of owner types added here are deleted
     * from the collection by the next sync.
     */
    @PatchMapping("/{configType}")
    public ResponseEntity<ExclusionConfiguration> updateConfiguration(
            @PathVariable String configType,
            @RequestBody ExclusionConfiguration updates) {
        log.info("Updating exclusion list {}", configType);
        return ResponseEntity.ok(configService.updateConfiguration(configType, updates));
    }

    /**
     * Deactivate a list: generation then excludes nothing on its account
     */
    @DeleteMapping("/{configType}")
    public ResponseEntity<Void> deleteConfiguration(@PathVariable String configType) {
        configService.deactivateConfiguration(configType);
        return ResponseEntity.noContent().build();
    }

    /**
     * Re-seed the default list for every type that has no active one
     */
    @PostMapping("/initialize")
    public ResponseEntity<List<ExclusionConfiguration>> initializeDefaults() {
        configService.initializeDefaultConfigurations();
        return ResponseEntity.ok(configService.getAllActiveConfigurations());
    }
}
