package com.apicatalog.collectionsync.service.schema;

import com.apicatalog.collectionsync.dto.schema.FieldSpec;
import com.apicatalog.collectionsync.dto.schema.MethodSpec;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the schema registry: record types, their fields and their exported callables.
 */
public interface SchemaReader {

    List<String> listModules();

    boolean moduleExists(String moduleName);

    /**
     * Owner types of one module, or of the whole installation when {@code moduleName} is null.
     */
    List<String> listTypes(String moduleName);

    boolean exists(String ownerType);

    Optional<String> getModule(String ownerType);

    /**
     * Fields of the owner type in declaration order.
     */
    List<FieldSpec> getFields(String ownerType);

    /**
     * Methods attached directly to the owner type's controller.
     */
    List<MethodSpec> getMethods(String ownerType);

    /**
     * Callables registered in module-level hook files, for every owner.
     */
    List<MethodSpec> getHookMethods();

    /**
     * Re-read the registry so later queries see types and fields changed since the last read.
     */
    void reload();
}
