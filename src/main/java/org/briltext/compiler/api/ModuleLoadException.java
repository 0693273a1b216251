package org.briltext.compiler.api;

/**
 * Thrown when an imported module cannot be found or read.
 */
public class ModuleLoadException extends BrilException {

    private final String moduleName;

    /**
     * @param moduleName The bare module name from the import directive.
     * @param message The detail message.
     * @param cause The underlying I/O failure, may be null.
     */
    public ModuleLoadException(String moduleName, String message, Throwable cause) {
        super(message, cause);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
