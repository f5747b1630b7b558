package com.apicatalog.collectionsync.service;

import com.apicatalog.collectionsync.model.ExclusionConfiguration;
import com.apicatalog.collectionsync.repository.ExclusionConfigurationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Loads exclusion lists from MongoDB. Lists are cached and evicted on every change.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExclusionConfigurationService {

    static final Set<String> DEFAULT_EXCLUDED_FIELD_NAMES = Set.of(
            "creation", "modified", "modified_by", "owner", "docstatus", "idx", "amended_from",
            "creation_date", "modified_date", "user", "user_type", "last_login", "login_after",
            "logout_time", "last_ip", "last_login_ip", "api_key", "api_secret");

    static final Set<String> DEFAULT_EXCLUDED_FIELD_TYPES = Set.of(
            "Section Break", "Column Break", "Tab Break", "HTML", "Button");

    static final Set<String> DEFAULT_EXCLUDED_OWNER_TYPES = Set.of(
            "DocType", "DocField", "Custom Field", "Property Setter", "Custom DocPerm", "User", "Role",
            "Permission", "Has Role", "Communication", "Version", "Error Log", "Activity Log", "File",
            "ToDo", "Comment", "Assignment", "Tag", "Tag Link", "API Generator", "Postman Setting");

    private final ExclusionConfigurationRepository configurationRepository;

    /**
     * Field names that never appear in a generated request body, whatever their flags.
     */
    @Cacheable("excludedFieldNames")
    public Set<String> getExcludedFieldNames() {
        return getValues(ExclusionConfiguration.EXCLUDED_FIELD_NAMES);
    }

    /**
     * Layout-only field types (section breaks, buttons) that carry no data.
     */
    @Cacheable("excludedFieldTypes")
    public Set<String> getExcludedFieldTypes() {
        return getValues(ExclusionConfiguration.EXCLUDED_FIELD_TYPES);
    }

    /**
     * Registry-internal owner types that never get descriptors.
     */
    @Cacheable("excludedOwnerTypes")
    public Set<String> getExcludedOwnerTypes() {
        return getValues(ExclusionConfiguration.EXCLUDED_OWNER_TYPES);
    }

    public List<ExclusionConfiguration> getAllActiveConfigurations() {
        return configurationRepository.findByActive(true);
    }

    public Optional<ExclusionConfiguration> getConfigurationByType(String configType) {
        requireKnownType(configType);
        return configurationRepository.findByConfigTypeAndActive(configType, true);
    }

    /**
     * Replace the values (trimmed, blanks dropped) or description of an active list.
     *
     * @throws IllegalArgumentException for a type other than the EXCLUDED_* lists, or one with no active list
     */
    @CacheEvict(cacheNames = {"excludedFieldNames", "excludedFieldTypes", "excludedOwnerTypes"}, allEntries = true)
    public ExclusionConfiguration updateConfiguration(String configType, ExclusionConfiguration updates) {
        requireKnownType(configType);
        ExclusionConfiguration config = configurationRepository.findByConfigTypeAndActive(configType, true)
                .orElseThrow(() -> new IllegalArgumentException("Configuration not found: " + configType));

        if (updates.getValues() != null) {
            config.setValues(normalize(updates.getValues()));
        }
        if (updates.getDescription() != null) {
            config.setDescription(updates.getDescription());
        }

        config.setVersion(config.getVersion() + 1);
        ExclusionConfiguration saved = configurationRepository.save(config);
        log.info("Updated exclusion configuration: {} (version: {})", configType, saved.getVersion());
        return saved;
    }

    @CacheEvict(cacheNames = {"excludedFieldNames", "excludedFieldTypes", "excludedOwnerTypes"}, allEntries = true)
    public void deactivateConfiguration(String configType) {
        requireKnownType(configType);
        configurationRepository.findByConfigTypeAndActive(configType, true).ifPresent(config -> {
            config.setActive(false);
            config.setVersion(config.getVersion() + 1);
            configurationRepository.save(config);
            log.info("Deactivated exclusion configuration: {}", configType);
        });
    }

    /**
     * Seed the default lists for any type that has no active configuration yet.
     */
    public void initializeDefaultConfigurations() {
        initialize(ExclusionConfiguration.EXCLUDED_FIELD_NAMES, DEFAULT_EXCLUDED_FIELD_NAMES,
                "System-managed field names left out of request bodies");
        initialize(ExclusionConfiguration.EXCLUDED_FIELD_TYPES, DEFAULT_EXCLUDED_FIELD_TYPES,
                "Layout field types that carry no data");
        initialize(ExclusionConfiguration.EXCLUDED_OWNER_TYPES, DEFAULT_EXCLUDED_OWNER_TYPES,
                "Registry-internal owner types never exposed as endpoints");
    }

    private void initialize(String configType, Set<String> defaults, String description) {
        if (configurationRepository.findByConfigTypeAndActive(configType, true).isPresent()) {
            return;
        }
        configurationRepository.save(ExclusionConfiguration.builder()
                .configType(configType)
                .values(new TreeSet<>(defaults))
                .description(description)
                .active(true)
                .version(1L)
                .build());
        log.info("Initialized default {} configuration", configType);
    }

    static void requireKnownType(String configType) {
        if (!ExclusionConfiguration.CONFIG_TYPES.contains(configType)) {
            throw new IllegalArgumentException("Unknown exclusion list: " + configType
                    + " (expected one of " + new TreeSet<>(ExclusionConfiguration.CONFIG_TYPES) + ")");
        }
    }

    private static Set<String> normalize(Set<String> values) {
        Set<String> normalized = new TreeSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                normalized.add(value.trim());
            }
        }
        return normalized;
    }

    private Set<String> getValues(String configType) {
        return configurationRepository.findByConfigTypeAndActive(configType, true)
                .map(ExclusionConfiguration::getValues)
                .map(values -> (Set<String>) new HashSet<>(values))
                .orElseGet(() -> {
                    log.warn("No active {} configuration found, nothing excluded by it", configType);
                    return Collections.emptySet();
                });
    }
}
