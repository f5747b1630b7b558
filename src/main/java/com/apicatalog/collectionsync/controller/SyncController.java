package com.apicatalog.collectionsync.controller;

import com.apicatalog.collectionsync.dto.GenerateRequest;
import com.apicatalog.collectionsync.dto.sync.SyncReport;
import com.apicatalog.collectionsync.model.SyncRunRecord;
import com.apicatalog.collectionsync.service.ApiCatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Syncing the catalog to the remote collection.
 */
@RestController
@RequestMapping("/api/sync")
@Slf4j
@RequiredArgsConstructor
public class SyncController {

    private final ApiCatalogService catalogService;

    /**
     * Generate for the given scope, then sync the whole catalog. Without a body only the sync runs.
     */
    @PostMapping
    public ResponseEntity<SyncReport> sync(@Valid @RequestBody(required = false) GenerateRequest request) {
        SyncReport report = request == null
                ? catalogService.synchronizeCatalog()
                : catalogService.generateAndSync(request.toScope());
        return ResponseEntity.ok(report);
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        int cancelled = catalogService.cancelActiveRuns();
        return ResponseEntity.ok(Map.of("cancelledRuns", cancelled));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<SyncRunRecord>> recentRuns() {
        return ResponseEntity.ok(catalogService.recentRuns());
    }

    @GetMapping("/runs/last")
    public ResponseEntity<SyncRunRecord> lastRun() {
        return catalogService.lastRun()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/environment")
    public ResponseEntity<Map<String, Object>> createEnvironment() {
        String environmentId = catalogService.createEnvironment();
        return ResponseEntity.ok(Map.of("environmentId", environmentId));
    }

    @GetMapping("/connection")
    public ResponseEntity<Map<String, Object>> testConnection() {
        boolean reachable = catalogService.testConnection();
        return ResponseEntity.ok(Map.of("reachable", reachable));
    }
}
