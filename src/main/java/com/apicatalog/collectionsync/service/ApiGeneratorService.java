package com.apicatalog.collectionsync.service;

import com.apicatalog.collectionsync.dto.*;
import com.apicatalog.collectionsync.exception.ModuleNotFoundException;
import com.apicatalog.collectionsync.exception.OwnerTypeNotFoundException;
import com.apicatalog.collectionsync.model.GeneratorRecord;
import com.apicatalog.collectionsync.repository.GeneratorRecordRepository;
import com.apicatalog.collectionsync.service.descriptor.EndpointDescriptorBuilder;
import com.apicatalog.collectionsync.service.extraction.FieldExclusionFilter;
import com.apicatalog.collectionsync.service.extraction.MetadataExtractor;
import com.apicatalog.collectionsync.service.schema.SchemaReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Generates endpoint descriptors for a scope and keeps one generator record per target.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ApiGeneratorService {

    private final MetadataExtractor metadataExtractor;
    private final EndpointDescriptorBuilder descriptorBuilder;
    private final GeneratorRecordRepository generatorRecordRepository;
    private final SchemaReader schemaReader;
    private final ExclusionConfigurationService exclusionConfigurationService;

    /**
     * Generate descriptors for the scope and upsert its generator record.
     *
     * @throws OwnerTypeNotFoundException for an unknown or excluded single type
     * @throws ModuleNotFoundException    for an unknown module
     */
    public GenerationResult generate(ExtractionScope scope) {
        log.info("Generating descriptors for scope {}", scope.describe());

        List<ExtractionFailure> failures = new ArrayList<>();
        List<OwnerDescriptors> owners = buildOwners(scope, failures);
        int descriptorCount = owners.stream().mapToInt(o -> o.getDescriptors().size()).sum();

        GeneratorRecord record = upsertRecord(scope, owners, failures);

        log.info("Generated {} descriptors for {} owner types in scope {} ({} failures)",
                descriptorCount, owners.size(), scope.describe(), failures.size());
        return GenerationResult.builder()
                .scope(scope.describe())
                .success(record.getStatus() == GeneratorRecord.Status.ACTIVE)
                .ownerCount(owners.size())
                .descriptorCount(descriptorCount)
                .failures(failures)
                .errorMessage(record.getLastError())
                .build();
    }

    /**
     * Generate for each owner type independently. Unknown or excluded types are reported, not thrown.
     */
    public Map<String, GenerationResult> bulkGenerate(List<String> ownerTypes) {
        Map<String, GenerationResult> results = new LinkedHashMap<>();
        for (String ownerType : ownerTypes) {
            ExtractionScope scope = ExtractionScope.singleType(ownerType);
            try {
                results.put(ownerType, generate(scope));
            } catch (OwnerTypeNotFoundException e) {
                log.warn("Bulk generation skipped {}: {}", ownerType, e.getMessage());
                results.put(ownerType, GenerationResult.builder()
                        .scope(scope.describe())
                        .success(false)
                        .errorMessage(e.getMessage())
                        .build());
            }
        }
        log.info("Bulk generation finished: {}/{} succeeded", results.values().stream()
                .filter(GenerationResult::isSuccess).count(), ownerTypes.size());
        return results;
    }

    /**
     * Descriptors of every owner in scope. Build errors are recorded per owner in {@code failures}.
     */
    public List<OwnerDescriptors> buildOwners(ExtractionScope scope, List<ExtractionFailure> failures) {
        FieldExclusionFilter filter = metadataExtractor.currentFilter();
        return metadataExtractor.stream(scope, failures)
                .map(owner -> buildOwner(owner, filter, failures))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * Regenerate every active record's target, one owner type appearing once even when
     * several records cover it.
     */
    public CatalogBuild buildCatalog() {
        List<GeneratorRecord> records = generatorRecordRepository.findByStatus(GeneratorRecord.Status.ACTIVE);
        Map<String, OwnerDescriptors> byOwner = new LinkedHashMap<>();
        Set<String> covered = new HashSet<>();
        List<ExtractionFailure> failures = new ArrayList<>();

        for (GeneratorRecord record : records) {
            record.getEndpoints().forEach(endpoint -> covered.add(endpoint.getOwnerType()));
            if (record.getGenerationType() == ExtractionScope.Type.SINGLE_TYPE) {
                covered.add(record.getTargetName());
            }
            try {
                for (OwnerDescriptors owner : buildOwners(record.toScope(), failures)) {
                    byOwner.putIfAbsent(owner.getOwnerType(), owner);
                    covered.add(owner.getOwnerType());
                }
            } catch (OwnerTypeNotFoundException | ModuleNotFoundException e) {
                log.warn("Generator target {} {} no longer resolves: {}",
                        record.getGenerationType(), record.getTargetName(), e.getMessage());
                failures.add(ExtractionFailure.builder()
                        .ownerType(record.getTargetName())
                        .stage("CATALOG")
                        .errorType(e.getClass().getSimpleName())
                        .message(e.getMessage())
                        .build());
            }
        }

        log.info("Catalog built from {} generator records: {} owner types", records.size(), byOwner.size());
        return CatalogBuild.builder()
                .owners(new ArrayList<>(byOwner.values()))
                .failures(failures)
                .coveredOwnerTypes(covered)
                .build();
    }

    public List<GeneratorRecord> getAllGenerators() {
        return generatorRecordRepository.findAll();
    }

    public List<GeneratorRecord> getGeneratorsByTarget(String targetName) {
        return generatorRecordRepository.findByTargetName(targetName);
    }

    /**
     * Every non-excluded owner type in the registry, sorted by name, with the most recently
     * updated generator record that covers it.
     */
    public List<OwnerTypeSummary> listOwnerTypes() {
        Set<String> excluded = exclusionConfigurationService.getExcludedOwnerTypes();
        List<GeneratorRecord> records = generatorRecordRepository.findAll();

        return schemaReader.listTypes(null).stream()
                .filter(ownerType -> !excluded.contains(ownerType))
                .distinct()
                .sorted()
                .map(ownerType -> summarize(ownerType, records))
                .collect(Collectors.toList());
    }

    // ========================= INTERNALS =========================

    private OwnerTypeSummary summarize(String ownerType, List<GeneratorRecord> records) {
        Optional<GeneratorRecord> latest = records.stream()
                .filter(record -> covers(record, ownerType))
                .max(Comparator.comparing(GeneratorRecord::getUpdatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())));

        return OwnerTypeSummary.builder()
                .ownerType(ownerType)
                .moduleName(schemaReader.getModule(ownerType).orElse(null))
                .hasGenerator(latest.isPresent())
                .status(latest.map(GeneratorRecord::getStatus).orElse(null))
                .endpointCount(latest.map(record -> (int) record.getEndpoints().stream()
                        .filter(endpoint -> ownerType.equals(endpoint.getOwnerType()))
                        .count()).orElse(0))
                .lastGeneratedAt(latest.map(GeneratorRecord::getUpdatedAt).orElse(null))
                .build();
    }

    private static boolean covers(GeneratorRecord record, String ownerType) {
        if (record.getGenerationType() == ExtractionScope.Type.SINGLE_TYPE) {
            return ownerType.equals(record.getTargetName());
        }
        return record.getEndpoints().stream().anyMatch(endpoint -> ownerType.equals(endpoint.getOwnerType()));
    }

    private OwnerDescriptors buildOwner(OwnerMetadata owner, FieldExclusionFilter filter,
                                        List<ExtractionFailure> failures) {
        try {
            return OwnerDescriptors.builder()
                    .ownerType(owner.getOwnerType())
                    .moduleName(owner.getModuleName())
                    .descriptors(descriptorBuilder.build(owner.getOwnerType(), owner.getFields(),
                            owner.getMethods(), filter))
                    .build();
        } catch (RuntimeException e) {
            log.warn("Failed to build descriptors for {}: {}", owner.getOwnerType(), e.getMessage());
            failures.add(ExtractionFailure.builder()
                    .ownerType(owner.getOwnerType())
                    .stage("BUILD")
                    .errorType(e.getClass().getSimpleName())
                    .message(e.getMessage())
                    .build());
            return null;
        }
    }

    private GeneratorRecord upsertRecord(ExtractionScope scope, List<OwnerDescriptors> owners,
                                         List<ExtractionFailure> failures) {
        String targetName = scope.getType() == ExtractionScope.Type.ALL ? GeneratorRecord.ALL_TARGET : scope.getName();
        GeneratorRecord record = generatorRecordRepository
                .findByGenerationTypeAndTargetName(scope.getType(), targetName)
                .orElseGet(() -> GeneratorRecord.builder()
                        .generationType(scope.getType())
                        .targetName(targetName)
                        .createdAt(LocalDateTime.now())
                        .build());

        List<GeneratorRecord.GeneratedEndpoint> endpoints = new ArrayList<>();
        for (OwnerDescriptors owner : owners) {
            for (EndpointDescriptor descriptor : owner.getDescriptors()) {
                endpoints.add(GeneratorRecord.GeneratedEndpoint.builder()
                        .ownerType(owner.getOwnerType())
                        .name(descriptor.getName())
                        .verb(descriptor.getVerb())
                        .path(descriptor.getPathTemplate())
                        .contentHash(descriptor.getContentHash())
                        .build());
            }
        }

        boolean failedOutright = owners.isEmpty() && !failures.isEmpty();
        record.setStatus(failedOutright ? GeneratorRecord.Status.ERROR : GeneratorRecord.Status.ACTIVE);
        record.setLastError(failedOutright ? failures.get(0).getMessage() : null);
        record.setModuleName(resolveModule(scope, owners));
        record.setEndpointCount(endpoints.size());
        record.setEndpoints(endpoints);
        record.setDescription("API endpoints for " + scope.describe());
        record.setUpdatedAt(LocalDateTime.now());

        return generatorRecordRepository.save(record);
    }

    private static String resolveModule(ExtractionScope scope, List<OwnerDescriptors> owners) {
        switch (scope.getType()) {
            case MODULE:
                return scope.getName();
            case SINGLE_TYPE:
                return owners.isEmpty() ? null : owners.get(0).getModuleName();
            default:
                return null;
        }
    }
}
