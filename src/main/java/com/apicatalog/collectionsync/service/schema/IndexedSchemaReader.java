package com.apicatalog.collectionsync.service.schema;

import com.apicatalog.collectionsync.dto.schema.FieldSpec;
import com.apicatalog.collectionsync.dto.schema.MethodSource;
import com.apicatalog.collectionsync.dto.schema.MethodSpec;
import com.apicatalog.collectionsync.dto.schema.SchemaIndex;
import com.apicatalog.collectionsync.exception.ModuleNotFoundException;
import com.apicatalog.collectionsync.exception.OwnerTypeNotFoundException;
import com.apicatalog.collectionsync.exception.SchemaIndexException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Schema reader backed by a serialized registry index (JSON or YAML).
 *
 * The index is loaded on first use and kept until {@link #reload()} is called,
 * e.g. after the registry reports a type change and the index file was rewritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexedSchemaReader implements SchemaReader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Value("${catalog.schema.index-path:classpath:schema-index.yml}")
    private String indexPath;

    private volatile Snapshot snapshot;

    /**
     * Reader over an in-memory index, bypassing resource loading.
     */
    public static IndexedSchemaReader of(SchemaIndex index) {
        IndexedSchemaReader reader = new IndexedSchemaReader(null, new ObjectMapper());
        reader.snapshot = new Snapshot(index);
        return reader;
    }

    @Override
    public synchronized void reload() {
        if (resourceLoader == null) {
            log.debug("In-memory schema index, nothing to reload");
            return;
        }
        snapshot = new Snapshot(loadIndex());
        log.info("Schema index reloaded from {}: {} modules, {} types",
                indexPath, snapshot.modules.size(), snapshot.types.size());
    }

    @Override
    public List<String> listModules() {
        return new ArrayList<>(snapshot().modules.keySet());
    }

    @Override
    public boolean moduleExists(String moduleName) {
        return snapshot().modules.containsKey(moduleName);
    }

    @Override
    public List<String> listTypes(String moduleName) {
        Snapshot current = snapshot();
        if (moduleName == null) {
            return new ArrayList<>(current.types.keySet());
        }
        SchemaIndex.ModuleEntry module = current.modules.get(moduleName);
        if (module == null) {
            throw new ModuleNotFoundException(moduleName);
        }
        List<String> names = new ArrayList<>();
        for (SchemaIndex.TypeEntry type : nullSafe(module.getTypes())) {
            names.add(type.getName());
        }
        return names;
    }

    @Override
    public boolean exists(String ownerType) {
        return snapshot().types.containsKey(ownerType);
    }

    @Override
    public Optional<String> getModule(String ownerType) {
        return Optional.ofNullable(snapshot().moduleOfType.get(ownerType));
    }

    @Override
    public List<FieldSpec> getFields(String ownerType) {
        SchemaIndex.TypeEntry type = requireType(ownerType);
        List<FieldSpec> fields = new ArrayList<>();
        for (SchemaIndex.FieldEntry field : nullSafe(type.getFields())) {
            fields.add(FieldSpec.builder()
                    .name(field.getName())
                    .dataType(field.getType())
                    .system(field.isSystem())
                    .auditable(field.isAuditable())
                    .build());
        }
        return fields;
    }

    @Override
    public List<MethodSpec> getMethods(String ownerType) {
        SchemaIndex.TypeEntry type = requireType(ownerType);
        List<MethodSpec> methods = new ArrayList<>();
        for (SchemaIndex.MethodEntry method : nullSafe(type.getMethods())) {
            methods.add(MethodSpec.builder()
                    .ownerType(ownerType)
                    .name(method.getName())
                    .parameterNames(nullSafe(method.getParameters()))
                    .sourceLocation(type.getController() != null ? type.getController() : ownerType + " controller")
                    .source(MethodSource.CONTROLLER)
                    .build());
        }
        return methods;
    }

    @Override
    public List<MethodSpec> getHookMethods() {
        List<MethodSpec> hooks = new ArrayList<>();
        for (SchemaIndex.ModuleEntry module : snapshot().modules.values()) {
            for (SchemaIndex.HookEntry hook : nullSafe(module.getHooks())) {
                hooks.add(MethodSpec.builder()
                        .ownerType(hook.getOwner())
                        .name(hook.getName())
                        .parameterNames(nullSafe(hook.getParameters()))
                        .sourceLocation(hook.getSource() != null ? hook.getSource() : module.getName() + "/hooks")
                        .source(MethodSource.HOOK)
                        .build());
            }
        }
        return hooks;
    }

    // ========================= LOADING =========================

    private Snapshot snapshot() {
        Snapshot current = snapshot;
        if (current == null) {
            synchronized (this) {
                if (snapshot == null) {
                    reload();
                }
                current = snapshot;
            }
        }
        return current;
    }

    private SchemaIndex.TypeEntry requireType(String ownerType) {
        SchemaIndex.TypeEntry type = snapshot().types.get(ownerType);
        if (type == null) {
            throw new OwnerTypeNotFoundException(ownerType);
        }
        return type;
    }

    private SchemaIndex loadIndex() {
        Resource resource = resourceLoader.getResource(indexPath);
        if (!resource.exists()) {
            throw new SchemaIndexException("Schema index not found: " + indexPath, null);
        }
        try (InputStream in = resource.getInputStream()) {
            if (isYaml(indexPath)) {
                Object raw = new Yaml().load(in);
                return raw == null ? new SchemaIndex() : objectMapper.convertValue(raw, SchemaIndex.class);
            }
            return objectMapper.readValue(in, SchemaIndex.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new SchemaIndexException("Failed to read schema index " + indexPath + ": " + e.getMessage(), e);
        }
    }

    private static boolean isYaml(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yml") || lower.endsWith(".yaml");
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }

    /**
     * Lookup tables over one loaded index. Replaced wholesale on reload.
     */
    private static final class Snapshot {
        private final Map<String, SchemaIndex.ModuleEntry> modules = new LinkedHashMap<>();
        private final Map<String, SchemaIndex.TypeEntry> types = new LinkedHashMap<>();
        private final Map<String, String> moduleOfType = new HashMap<>();

        private Snapshot(SchemaIndex index) {
            for (SchemaIndex.ModuleEntry module : nullSafe(index.getModules())) {
                modules.put(module.getName(), module);
                for (SchemaIndex.TypeEntry type : nullSafe(module.getTypes())) {
                    if (types.putIfAbsent(type.getName(), type) != null) {
                        log.warn("Owner type {} declared by more than one module, keeping {}",
                                type.getName(), moduleOfType.get(type.getName()));
                        continue;
                    }
                    moduleOfType.put(type.getName(), module.getName());
                }
            }
        }
    }
}
