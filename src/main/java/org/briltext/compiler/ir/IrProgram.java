package org.briltext.compiler.ir;

import java.util.List;

/**
 * A Bril program: the modules it imports and the functions it defines.
 * The order of functions is preserved by every phase.
 *
 * @param imports The imported module names, empty when the program imports nothing.
 * @param functions The function definitions.
 */
public record IrProgram(List<String> imports, List<IrFunction> functions) {

    public IrProgram {
        imports = List.copyOf(imports);
        functions = List.copyOf(functions);
    }

    /**
     * Creates a program without imports.
     * @param functions The function definitions.
     */
    public IrProgram(List<IrFunction> functions) {
        this(List.of(), functions);
    }

    public boolean hasImports() {
        return !imports.isEmpty();
    }
}
