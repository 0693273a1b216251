package org.briltext.compiler.frontend.module;

import org.briltext.compiler.api.BrilException;
import org.briltext.compiler.api.DuplicateFunctionException;
import org.briltext.compiler.ir.IrFunction;
import org.briltext.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges every module transitively imported by a program into one function namespace.
 * <p>
 * Modules are loaded in order of first discovery, each at most once. The result contains the
 * root's functions followed by the functions of each loaded module and carries no imports.
 * Any function name defined by more than one module aborts the merge.
 */
public final class ImportResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ImportResolver.class);

    private final ModuleLoader loader;

    /**
     * @param loader The collaborator used to load modules by name.
     */
    public ImportResolver(ModuleLoader loader) {
        this.loader = loader;
    }

    /**
     * Resolves all imports of the given program.
     *
     * @param program The root program.
     * @return The program itself if it has no imports, otherwise a new merged program.
     * @throws BrilException if a module cannot be loaded or a function is defined twice.
     */
    public IrProgram resolve(IrProgram program) throws BrilException {
        if (!program.hasImports()) {
            return program;
        }

        Set<String> pending = new LinkedHashSet<>(program.imports());
        Set<String> seen = new HashSet<>();
        Map<String, IrFunction> merged = new LinkedHashMap<>();
        for (IrFunction function : program.functions()) {
            merged.put(function.name(), function);
        }

        while (!pending.isEmpty()) {
            Iterator<String> it = pending.iterator();
            String moduleName = it.next();
            it.remove();
            seen.add(moduleName);

            IrProgram module = loader.load(moduleName);
            LOG.debug("Loaded module '{}' with {} function(s)", moduleName, module.functions().size());

            for (String imported : module.imports()) {
                if (!seen.contains(imported)) {
                    pending.add(imported);
                }
            }

            List<String> collisions = new ArrayList<>();
            for (IrFunction function : module.functions()) {
                if (merged.containsKey(function.name())) {
                    collisions.add(function.name());
                }
            }
            if (!collisions.isEmpty()) {
                throw new DuplicateFunctionException(collisions);
            }
            for (IrFunction function : module.functions()) {
                merged.put(function.name(), function);
            }
        }

        return new IrProgram(new ArrayList<>(merged.values()));
    }
}
