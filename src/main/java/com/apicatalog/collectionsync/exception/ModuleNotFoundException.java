package com.apicatalog.collectionsync.exception;

public class ModuleNotFoundException extends RuntimeException {

    public ModuleNotFoundException(String moduleName) {
        super("Module not found: " + moduleName);
    }
}
