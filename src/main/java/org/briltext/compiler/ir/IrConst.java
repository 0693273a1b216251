package org.briltext.compiler.ir;

/**
 * Loads a literal into a variable: {@code dest: type = const value}.
 */
public record IrConst(String dest, String type, IrValue value) implements IrItem {

    /** The operation name every constant instruction carries in the interchange format. */
    public static final String OPCODE = "const";
}
