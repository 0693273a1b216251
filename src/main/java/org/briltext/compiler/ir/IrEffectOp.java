package org.briltext.compiler.ir;

import java.util.List;

/**
 * An operation executed only for its effect (print, jmp, br, ret, ...).
 */
public record IrEffectOp(String op, List<String> args) implements IrItem {

    public IrEffectOp {
        args = List.copyOf(args);
    }
}
