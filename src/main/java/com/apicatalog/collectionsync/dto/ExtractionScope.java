package com.apicatalog.collectionsync.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What a generation pass scans: one owner type, every type of a module, or the whole installation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExtractionScope {

    public enum Type {
        SINGLE_TYPE,
        MODULE,
        ALL
    }

    Type type;
    String name;

    public static ExtractionScope singleType(String ownerType) {
        return new ExtractionScope(Type.SINGLE_TYPE, ownerType);
    }

    public static ExtractionScope module(String moduleName) {
        return new ExtractionScope(Type.MODULE, moduleName);
    }

    public static ExtractionScope all() {
        return new ExtractionScope(Type.ALL, null);
    }

    public static ExtractionScope of(Type type, String name) {
        if (type == null) {
            throw new IllegalArgumentException("Scope type is required");
        }
        if (type != Type.ALL && (name == null || name.isBlank())) {
            throw new IllegalArgumentException("Scope " + type + " requires a name");
        }
        return type == Type.ALL ? all() : new ExtractionScope(type, name);
    }

    public String describe() {
        return type == Type.ALL ? "ALL" : type + "(" + name + ")";
    }
}
