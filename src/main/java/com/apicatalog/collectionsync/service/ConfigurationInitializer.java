package com.apicatalog.collectionsync.service;

import com.apicatalog.collectionsync.exception.SchemaIndexException;
import com.apicatalog.collectionsync.service.schema.SchemaReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Startup: seeds missing exclusion lists, then loads the schema index and reports how many
 * registry owner types the owner-type list leaves for generation.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfigurationInitializer implements CommandLineRunner {

    private final ExclusionConfigurationService configService;
    private final SchemaReader schemaReader;

    @Override
    public void run(String... args) {
        configService.initializeDefaultConfigurations();
        Set<String> excludedOwnerTypes = configService.getExcludedOwnerTypes();
        log.info("Exclusion lists ready: {} field names, {} field types, {} owner types",
                configService.getExcludedFieldNames().size(),
                configService.getExcludedFieldTypes().size(),
                excludedOwnerTypes.size());

        try {
            List<String> ownerTypes = schemaReader.listTypes(null);
            long generatable = ownerTypes.stream().filter(type -> !excludedOwnerTypes.contains(type)).count();
            log.info("Schema index loaded: {} modules, {} of {} owner types generatable",
                    schemaReader.listModules().size(), generatable, ownerTypes.size());
        } catch (SchemaIndexException e) {
            // generation requests fail with 503 until the index becomes readable
            log.warn("Schema index not loaded at startup: {}", e.getMessage());
        }
    }
}
