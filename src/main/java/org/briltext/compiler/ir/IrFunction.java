package org.briltext.compiler.ir;

import java.util.List;
import java.util.Optional;

/**
 * A function definition.
 *
 * @param name The function name.
 * @param args The parameters, empty when the function takes none.
 * @param returnType The return type, or null when the function returns nothing.
 * @param instrs The instructions and labels of the body in order.
 */
public record IrFunction(String name, List<IrArg> args, String returnType, List<IrItem> instrs) {

    public IrFunction {
        args = List.copyOf(args);
        instrs = List.copyOf(instrs);
    }

    public Optional<String> returnTypeIfPresent() {
        return Optional.ofNullable(returnType);
    }
}
