package org.briltext.compiler.backend.emit;

import org.briltext.compiler.ir.IrArg;
import org.briltext.compiler.ir.IrConst;
import org.briltext.compiler.ir.IrEffectOp;
import org.briltext.compiler.ir.IrFunction;
import org.briltext.compiler.ir.IrItem;
import org.briltext.compiler.ir.IrLabelDef;
import org.briltext.compiler.ir.IrProgram;
import org.briltext.compiler.ir.IrValueOp;

import java.util.List;

/**
 * The final stage of the text pipeline. It walks a structured {@link IrProgram}
 * and renders it in the Bril text format, one instruction or label per line.
 * <p>
 * By default the function header carries only the name. When signatures are enabled,
 * parameters and the return type are printed in the grammar's own syntax so that the
 * output parses back into an identical program.
 */
public class TextEmitter {

    private static final String INDENT = "  ";

    private final boolean emitSignatures;

    /**
     * Creates an emitter that prints the name-only function header.
     */
    public TextEmitter() {
        this(false);
    }

    /**
     * @param emitSignatures Whether function headers include parameters and the return type.
     */
    public TextEmitter(boolean emitSignatures) {
        this.emitSignatures = emitSignatures;
    }

    /**
     * Renders the given program. Imports are not printed.
     *
     * @param program The program to render.
     * @return The program text; every line, including the last, ends with a newline.
     */
    public String emit(IrProgram program) {
        StringBuilder out = new StringBuilder();
        for (IrFunction function : program.functions()) {
            emitFunction(function, out);
        }
        return out.toString();
    }

    private void emitFunction(IrFunction function, StringBuilder out) {
        out.append(function.name());
        if (emitSignatures) {
            for (IrArg arg : function.args()) {
                out.append(' ').append(formatArg(arg));
            }
            function.returnTypeIfPresent().ifPresent(type -> out.append(": ").append(type));
        }
        out.append(" {\n");
        for (IrItem item : function.instrs()) {
            out.append(INDENT).append(formatItem(item)).append('\n');
        }
        out.append("}\n");
    }

    private static String formatArg(IrArg arg) {
        if (arg.type() == null) {
            return arg.name();
        }
        return "(" + arg.name() + ": " + arg.type() + ")";
    }

    /**
     * Renders a single instruction or label without indentation or line break.
     *
     * @param item The instruction or label.
     * @return The rendered line.
     */
    public static String formatItem(IrItem item) {
        if (item instanceof IrConst c) {
            return c.dest() + ": " + c.type() + " = " + IrConst.OPCODE + " " + c.value().toLiteral() + ";";
        }
        if (item instanceof IrValueOp v) {
            return v.dest() + ": " + v.type() + " = " + withOperands(v.op(), v.args()) + ";";
        }
        if (item instanceof IrEffectOp e) {
            return withOperands(e.op(), e.args()) + ";";
        }
        if (item instanceof IrLabelDef l) {
            return l.name() + ":";
        }
        throw new IllegalArgumentException("Unknown IR item: " + item);
    }

    private static String withOperands(String op, List<String> args) {
        if (args.isEmpty()) {
            return op;
        }
        return op + " " + String.join(" ", args);
    }
}
