package com.ivamare.interactions.exception;

/**
 * Thrown when an interaction module cannot be loaded.
 */
public class ModuleLoadException extends InteractionsException {

    private final String moduleName;

    public ModuleLoadException(String moduleName, String message) {
        super("Cannot load module " + moduleName + ": " + message);
        this.moduleName = moduleName;
    }

    public ModuleLoadException(String moduleName, String message, Throwable cause) {
        super("Cannot load module " + moduleName + ": " + message, cause);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
