package com.apicatalog.collectionsync.controller;

import com.apicatalog.collectionsync.dto.BulkGenerateRequest;
import com.apicatalog.collectionsync.dto.GenerateRequest;
import com.apicatalog.collectionsync.dto.GenerationResult;
import com.apicatalog.collectionsync.dto.OwnerTypeSummary;
import com.apicatalog.collectionsync.event.SchemaChangedEvent;
import com.apicatalog.collectionsync.model.GeneratorRecord;
import com.apicatalog.collectionsync.service.ApiCatalogService;
import com.apicatalog.collectionsync.service.ApiGeneratorService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Descriptor generation and generator records.
 */
@RestController
@RequestMapping("/api/generators")
@Slf4j
@RequiredArgsConstructor
public class GeneratorController {

    private final ApiCatalogService catalogService;
    private final ApiGeneratorService generatorService;
    private final ApplicationEventPublisher eventPublisher;

    @GetMapping
    public ResponseEntity<List<GeneratorRecord>> getAllGenerators() {
        return ResponseEntity.ok(generatorService.getAllGenerators());
    }

    /**
     * Owner types that can be generated, with the status of the record covering each
     */
    @GetMapping("/owner-types")
    public ResponseEntity<List<OwnerTypeSummary>> listOwnerTypes() {
        return ResponseEntity.ok(generatorService.listOwnerTypes());
    }

    /**
     * Records whose target is the given owner type or module
     */
    @GetMapping("/{name}")
    public ResponseEntity<List<GeneratorRecord>> getGenerators(@PathVariable String name) {
        List<GeneratorRecord> records = generatorService.getGeneratorsByTarget(name);
        if (records.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(records);
    }

    @PostMapping("/generate")
    public ResponseEntity<GenerationResult> generate(@Valid @RequestBody GenerateRequest request) {
        log.info("Generation requested: {} {}", request.getScopeType(), request.getName());
        return ResponseEntity.ok(catalogService.generate(request.toScope()));
    }

    @PostMapping("/bulk")
    public ResponseEntity<Map<String, GenerationResult>> bulkGenerate(@Valid @RequestBody BulkGenerateRequest request) {
        log.info("Bulk generation requested for {} owner types", request.getOwnerTypes().size());
        return ResponseEntity.ok(generatorService.bulkGenerate(request.getOwnerTypes()));
    }

    /**
     * Notify that an owner type's schema was saved; regeneration runs in the background
     */
    @PostMapping("/schema-changed/{ownerType}")
    public ResponseEntity<Void> schemaChanged(@PathVariable String ownerType) {
        eventPublisher.publishEvent(new SchemaChangedEvent(ownerType));
        return ResponseEntity.accepted().build();
    }
}
