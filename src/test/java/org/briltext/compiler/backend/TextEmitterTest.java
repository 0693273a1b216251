package org.briltext.compiler.backend;

import org.briltext.compiler.backend.emit.TextEmitter;
import org.briltext.compiler.ir.IrArg;
import org.briltext.compiler.ir.IrConst;
import org.briltext.compiler.ir.IrEffectOp;
import org.briltext.compiler.ir.IrFunction;
import org.briltext.compiler.ir.IrLabelDef;
import org.briltext.compiler.ir.IrProgram;
import org.briltext.compiler.ir.IrValue;
import org.briltext.compiler.ir.IrValueOp;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link TextEmitter}.
 */
@Tag("unit")
class TextEmitterTest {

    private static final IrFunction ADD5 = new IrFunction(
            "add5",
            List.of(new IrArg("n", "int"), new IrArg("k", null)),
            "int",
            List.of(
                    new IrConst("five", "int", new IrValue.Int64(5)),
                    new IrValueOp("sum", "int", "add", List.of("n", "five")),
                    new IrLabelDef("done"),
                    new IrEffectOp("ret", List.of("sum"))));

    @Test
    void printsEveryItemKindWithNameOnlyHeader() {
        String text = new TextEmitter().emit(new IrProgram(List.of(ADD5)));

        assertThat(text).isEqualTo("""
                add5 {
                  five: int = const 5;
                  sum: int = add n five;
                  done:
                  ret sum;
                }
                """);
    }

    @Test
    void printsSignatureWhenEnabled() {
        String text = new TextEmitter(true).emit(new IrProgram(List.of(ADD5)));

        assertThat(text).startsWith("add5 (n: int) k: int {\n");
    }

    @Test
    void operationWithoutOperandsHasNoTrailingSpace() {
        assertThat(TextEmitter.formatItem(new IrEffectOp("ret", List.of()))).isEqualTo("ret;");
        assertThat(TextEmitter.formatItem(new IrValueOp("x", "int", "call", List.of()))).isEqualTo("x: int = call;");
    }

    @Test
    void booleansArePrintedInLowerCase() {
        assertThat(TextEmitter.formatItem(new IrConst("b", "bool", new IrValue.Bool(true))))
                .isEqualTo("b: bool = const true;");
    }

    @Test
    void emptyProgramPrintsNothing() {
        assertThat(new TextEmitter().emit(new IrProgram(List.of()))).isEmpty();
    }

    @Test
    void importsAreNotPrinted() {
        IrProgram program = new IrProgram(List.of("lib"), List.of(new IrFunction("main", List.of(), null, List.of())));

        assertThat(new TextEmitter().emit(program)).isEqualTo("main {\n}\n");
    }
}
