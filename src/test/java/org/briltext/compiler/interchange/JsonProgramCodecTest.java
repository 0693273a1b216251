package org.briltext.compiler.interchange;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.briltext.compiler.Compiler;
import org.briltext.compiler.api.InterchangeFormatException;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonProgramCodec}: field presence, key order and error handling.
 */
@Tag("unit")
class JsonProgramCodecTest {

    private final JsonProgramCodec codec = new JsonProgramCodec();

    @Test
    void writesSortedKeysAndOmitsEmptyOptionalFields() {
        // Arrange
        IrProgram program = new IrProgram(List.of(new IrFunction("main", List.of(), null, List.of(
                new IrConst("v", "int", new IrValue.Int64(1)),
                new IrEffectOp("print", List.of("v"))))));

        // Act
        String json = codec.toJson(program);

        // Assert
        assertThat(json).isEqualTo("""
                {
                  "functions": [
                    {
                      "instrs": [
                        {
                          "dest": "v",
                          "op": "const",
                          "type": "int",
                          "value": 1
                        },
                        {
                          "args": [
                            "v"
                          ],
                          "op": "print"
                        }
                      ],
                      "name": "main"
                    }
                  ]
                }""");
    }

    @Test
    void writesImportsArgsAndReturnTypeWhenPresent() {
        // Arrange
        IrProgram program = new IrProgram(List.of("lib"), List.of(new IrFunction(
                "f", List.of(new IrArg("x", "int")), "bool", List.of(new IrLabelDef("top")))));

        // Act
        JsonObject root = JsonParser.parseString(new JsonProgramCodec(false).toJson(program)).getAsJsonObject();

        // Assert
        assertThat(root.keySet()).containsExactly("functions", "imports");
        JsonObject f = root.getAsJsonArray("functions").get(0).getAsJsonObject();
        assertThat(f.keySet()).containsExactly("args", "instrs", "name", "type");
        assertThat(f.get("type").getAsString()).isEqualTo("bool");
        assertThat(f.getAsJsonArray("instrs").get(0).getAsJsonObject().get("label").getAsString()).isEqualTo("top");
    }

    @Test
    void valueOperationKeys() {
        IrProgram program = new IrProgram(List.of(new IrFunction("main", List.of(), null,
                List.of(new IrValueOp("s", "int", "add", List.of("a", "b"))))));

        JsonObject instr = JsonParser.parseString(codec.toJson(program)).getAsJsonObject()
                .getAsJsonArray("functions").get(0).getAsJsonObject()
                .getAsJsonArray("instrs").get(0).getAsJsonObject();

        assertThat(instr.keySet()).containsExactly("args", "dest", "op", "type");
    }

    @Test
    void readsEveryInstructionKind() throws Exception {
        // Arrange
        String json = """
                {"imports": ["lib"], "functions": [{
                  "name": "main", "type": "int",
                  "args": [{"name": "n", "type": "int"}, {"name": "k"}],
                  "instrs": [
                    {"op": "const", "dest": "t", "type": "bool", "value": true},
                    {"op": "const", "dest": "c", "type": "int", "value": -3},
                    {"op": "id", "dest": "u", "type": "bool", "args": ["t"]},
                    {"label": "end"},
                    {"op": "ret", "args": ["c"]},
                    {"op": "nop"}
                  ]}]}
                """;

        // Act
        IrProgram program = codec.fromJson(json);

        // Assert
        assertThat(program.imports()).containsExactly("lib");
        IrFunction main = program.functions().get(0);
        assertThat(main.returnType()).isEqualTo("int");
        assertThat(main.args()).containsExactly(new IrArg("n", "int"), new IrArg("k", null));
        assertThat(main.instrs()).containsExactly(
                new IrConst("t", "bool", new IrValue.Bool(true)),
                new IrConst("c", "int", new IrValue.Int64(-3)),
                new IrValueOp("u", "bool", "id", List.of("t")),
                new IrLabelDef("end"),
                new IrEffectOp("ret", List.of("c")),
                new IrEffectOp("nop", List.of()));
    }

    @Test
    void readsWhatItWrites() throws Exception {
        IrProgram program = new IrProgram(List.of("a", "b"), List.of(new IrFunction(
                "f", List.of(new IrArg("x", null)), null,
                List.of(new IrConst("big", "int", new IrValue.Int64(Long.MIN_VALUE))))));

        assertThat(codec.fromJson(codec.toJson(program))).isEqualTo(program);
    }

    /**
     * A value operation named "const" has no literal and must come back as a value operation.
     */
    @Test
    void constOperationWithIdentifierOperandSurvivesJson() throws Exception {
        // Arrange
        IrProgram parsed = new Compiler().parse("main { a: int = const b; }", "main.bril");

        // Act
        String json = codec.toJson(parsed);
        IrProgram read = codec.fromJson(json);

        // Assert
        assertThat(json).doesNotContain("\"value\"");
        assertThat(read).isEqualTo(parsed);
        assertThat(read.functions().get(0).instrs())
                .containsExactly(new IrValueOp("a", "int", "const", List.of("b")));
    }

    @Test
    void constWithNullValueIsRejected() {
        String json = "{\"functions\": [{\"name\": \"m\", \"instrs\": ["
                + "{\"op\": \"const\", \"dest\": \"x\", \"type\": \"int\", \"value\": null}]}]}";

        assertThatThrownBy(() -> codec.fromJson(json))
                .isInstanceOf(InterchangeFormatException.class)
                .hasMessageContaining("value");
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> codec.fromJson("{\"functions\": ["))
                .isInstanceOf(InterchangeFormatException.class)
                .hasMessageStartingWith("Malformed JSON program");
    }

    @Test
    void missingFunctionsIsRejected() {
        assertThatThrownBy(() -> codec.fromJson("{}"))
                .isInstanceOf(InterchangeFormatException.class)
                .hasMessageContaining("functions");
    }

    @Test
    void fractionalConstIsRejected() {
        String json = "{\"functions\": [{\"name\": \"m\", \"instrs\": ["
                + "{\"op\": \"const\", \"dest\": \"x\", \"type\": \"int\", \"value\": 1.5}]}]}";

        assertThatThrownBy(() -> codec.fromJson(json))
                .isInstanceOf(InterchangeFormatException.class)
                .hasMessageContaining("1.5");
    }
}
