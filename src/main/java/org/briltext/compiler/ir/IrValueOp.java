package org.briltext.compiler.ir;

import java.util.List;

/**
 * An operation that computes a value into a destination variable.
 */
public record IrValueOp(String dest, String type, String op, List<String> args) implements IrItem {

    public IrValueOp {
        args = List.copyOf(args);
    }
}
