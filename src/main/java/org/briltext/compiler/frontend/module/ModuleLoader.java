package org.briltext.compiler.frontend.module;

import org.briltext.compiler.api.BrilException;
import org.briltext.compiler.ir.IrProgram;

/**
 * Loads an imported module by its bare name.
 */
@FunctionalInterface
public interface ModuleLoader {

    /**
     * @param moduleName The module name as written in the import directive.
     * @return The parsed module.
     * @throws BrilException if the module is unavailable or does not parse.
     */
    IrProgram load(String moduleName) throws BrilException;
}
