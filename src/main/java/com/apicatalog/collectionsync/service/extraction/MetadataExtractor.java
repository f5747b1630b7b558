package com.apicatalog.collectionsync.service.extraction;

import com.apicatalog.collectionsync.dto.ExtractionFailure;
import com.apicatalog.collectionsync.dto.ExtractionResult;
import com.apicatalog.collectionsync.dto.ExtractionScope;
import com.apicatalog.collectionsync.dto.OwnerMetadata;
import com.apicatalog.collectionsync.dto.schema.FieldSpec;
import com.apicatalog.collectionsync.dto.schema.MethodSpec;
import com.apicatalog.collectionsync.exception.ExcludedOwnerTypeException;
import com.apicatalog.collectionsync.exception.ModuleNotFoundException;
import com.apicatalog.collectionsync.exception.OwnerTypeNotFoundException;
import com.apicatalog.collectionsync.service.ExclusionConfigurationService;
import com.apicatalog.collectionsync.service.schema.SchemaReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks the schema registry over a scan scope and collects, per owner type, its fields and
 * the callable methods found on its controller and in module hook files.
 *
 * <p>Method discovery merges two surfaces. A method registered on both is reported once,
 * keyed by {@code (ownerType, name)}, and the controller entry wins.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetadataExtractor {

    private final SchemaReader schemaReader;
    private final ExclusionConfigurationService exclusionConfigurationService;

    /**
     * Extract every owner in scope. Failures on single owners are recorded in the result.
     *
     * @throws OwnerTypeNotFoundException when a single-type scope names an unknown or excluded type
     * @throws ModuleNotFoundException    when a module scope names an unknown module
     */
    public ExtractionResult extract(ExtractionScope scope) {
        List<ExtractionFailure> failures = new ArrayList<>();
        List<OwnerMetadata> owners = stream(scope, failures).collect(Collectors.toList());

        log.info("Extracted {} owner types for scope {} ({} failed)", owners.size(), scope.describe(), failures.size());
        return ExtractionResult.builder()
                .owners(owners)
                .failures(failures)
                .build();
    }

    /**
     * Lazily extract the owners in scope. For {@code ALL} the registry is read module by module,
     * so only one module's type list is held at a time.
     *
     * @param failures sink for per-owner failures, appended to as the stream is consumed
     */
    public Stream<OwnerMetadata> stream(ExtractionScope scope, List<ExtractionFailure> failures) {
        Stream<String> ownerTypes = resolveOwnerTypes(scope);
        Map<String, List<MethodSpec>> hooksByOwner = hooksByOwner();

        return ownerTypes
                .map(ownerType -> extractOwner(ownerType, hooksByOwner, failures))
                .filter(Objects::nonNull);
    }

    /**
     * The body filter built from the current exclusion configuration.
     */
    public FieldExclusionFilter currentFilter() {
        return FieldExclusionFilter.of(
                exclusionConfigurationService.getExcludedFieldNames(),
                exclusionConfigurationService.getExcludedFieldTypes());
    }

    // ========================= SCOPE RESOLUTION =========================

    private Stream<String> resolveOwnerTypes(ExtractionScope scope) {
        switch (scope.getType()) {
            case SINGLE_TYPE:
                return Stream.of(resolveSingleType(scope.getName()));
            case MODULE:
                if (!schemaReader.moduleExists(scope.getName())) {
                    throw new ModuleNotFoundException(scope.getName());
                }
                return withoutExcluded(schemaReader.listTypes(scope.getName()).stream());
            case ALL:
                // a type declared in two modules is still one owner
                return withoutExcluded(schemaReader.listModules().stream()
                        .flatMap(module -> schemaReader.listTypes(module).stream())
                        .distinct());
            default:
                throw new IllegalArgumentException("Unsupported scope: " + scope.getType());
        }
    }

    private String resolveSingleType(String ownerType) {
        if (!schemaReader.exists(ownerType)) {
            throw new OwnerTypeNotFoundException(ownerType);
        }
        if (exclusionConfigurationService.getExcludedOwnerTypes().contains(ownerType)) {
            throw new ExcludedOwnerTypeException(ownerType);
        }
        return ownerType;
    }

    private Stream<String> withoutExcluded(Stream<String> ownerTypes) {
        Set<String> excluded = exclusionConfigurationService.getExcludedOwnerTypes();
        return ownerTypes.filter(ownerType -> {
            if (excluded.contains(ownerType)) {
                log.debug("Skipping excluded owner type {}", ownerType);
                return false;
            }
            return true;
        });
    }

    // ========================= PER-OWNER EXTRACTION =========================

    private OwnerMetadata extractOwner(String ownerType, Map<String, List<MethodSpec>> hooksByOwner,
                                       List<ExtractionFailure> failures) {
        try {
            List<FieldSpec> fields = schemaReader.getFields(ownerType);
            List<MethodSpec> methods = mergeMethods(ownerType, schemaReader.getMethods(ownerType),
                    hooksByOwner.getOrDefault(ownerType, Collections.emptyList()));

            return OwnerMetadata.builder()
                    .ownerType(ownerType)
                    .moduleName(schemaReader.getModule(ownerType).orElse(null))
                    .fields(List.copyOf(fields))
                    .methods(List.copyOf(methods))
                    .build();
        } catch (RuntimeException e) {
            log.warn("Failed to extract metadata for owner type {}: {}", ownerType, e.getMessage());
            failures.add(ExtractionFailure.builder()
                    .ownerType(ownerType)
                    .stage("EXTRACT")
                    .errorType(e.getClass().getSimpleName())
                    .message(e.getMessage())
                    .build());
            return null;
        }
    }

    private List<MethodSpec> mergeMethods(String ownerType, List<MethodSpec> controllerMethods,
                                          List<MethodSpec> hookMethods) {
        Map<String, MethodSpec> byKey = new LinkedHashMap<>();
        for (MethodSpec method : controllerMethods) {
            byKey.putIfAbsent(method.key(), method);
        }
        for (MethodSpec method : hookMethods) {
            MethodSpec existing = byKey.putIfAbsent(method.key(), method);
            if (existing != null) {
                log.debug("Method {}.{} found on controller ({}) and in hooks ({}), reporting once",
                        ownerType, method.getName(), existing.getSourceLocation(), method.getSourceLocation());
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private Map<String, List<MethodSpec>> hooksByOwner() {
        Map<String, List<MethodSpec>> grouped = new HashMap<>();
        for (MethodSpec hook : schemaReader.getHookMethods()) {
            if (hook.getOwnerType() == null) {
                log.debug("Ignoring hook {} without a declared owner", hook.getName());
                continue;
            }
            grouped.computeIfAbsent(hook.getOwnerType(), k -> new ArrayList<>()).add(hook);
        }
        return grouped;
    }
}
