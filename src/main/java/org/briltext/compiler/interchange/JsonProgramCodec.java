package org.briltext.compiler.interchange;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.briltext.compiler.api.InterchangeFormatException;
import org.briltext.compiler.ir.IrArg;
import org.briltext.compiler.ir.IrConst;
import org.briltext.compiler.ir.IrEffectOp;
import org.briltext.compiler.ir.IrFunction;
import org.briltext.compiler.ir.IrItem;
import org.briltext.compiler.ir.IrLabelDef;
import org.briltext.compiler.ir.IrProgram;
import org.briltext.compiler.ir.IrValue;
import org.briltext.compiler.ir.IrValueOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts structured programs to and from the canonical JSON interchange format.
 * <p>
 * Keys are written in sorted order. Empty imports, empty parameter lists and a missing
 * return type are left out of the output entirely.
 */
public final class JsonProgramCodec {

    private static final String FUNCTIONS = "functions";
    private static final String IMPORTS = "imports";
    private static final String NAME = "name";
    private static final String ARGS = "args";
    private static final String TYPE = "type";
    private static final String INSTRS = "instrs";
    private static final String OP = "op";
    private static final String DEST = "dest";
    private static final String VALUE = "value";
    private static final String LABEL = "label";

    private final Gson gson;

    /**
     * Creates a codec that pretty-prints with two-space indentation.
     */
    public JsonProgramCodec() {
        this(true);
    }

    /**
     * @param prettyPrint Whether to indent the output; otherwise it is written on one line.
     */
    public JsonProgramCodec(boolean prettyPrint) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (prettyPrint) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    /**
     * Serializes a program.
     *
     * @param program The program to serialize.
     * @return The JSON document, without a trailing newline.
     */
    public String toJson(IrProgram program) {
        return gson.toJson(programToTree(program));
    }

    /**
     * Builds the JSON tree of a program with keys in sorted order.
     *
     * @param program The program.
     * @return The JSON object.
     */
    public JsonObject programToTree(IrProgram program) {
        JsonObject root = new JsonObject();
        JsonArray functions = new JsonArray();
        program.functions().forEach(f -> functions.add(functionToTree(f)));
        root.add(FUNCTIONS, functions);
        if (program.hasImports()) {
            root.add(IMPORTS, strings(program.imports()));
        }
        return root;
    }

    private JsonObject functionToTree(IrFunction function) {
        JsonObject obj = new JsonObject();
        if (!function.args().isEmpty()) {
            JsonArray args = new JsonArray();
            for (IrArg arg : function.args()) {
                JsonObject a = new JsonObject();
                a.addProperty(NAME, arg.name());
                if (arg.type() != null) {
                    a.addProperty(TYPE, arg.type());
                }
                args.add(a);
            }
            obj.add(ARGS, args);
        }
        JsonArray instrs = new JsonArray();
        function.instrs().forEach(item -> instrs.add(itemToTree(item)));
        obj.add(INSTRS, instrs);
        obj.addProperty(NAME, function.name());
        if (function.returnType() != null) {
            obj.addProperty(TYPE, function.returnType());
        }
        return obj;
    }

    private JsonObject itemToTree(IrItem item) {
        JsonObject obj = new JsonObject();
        if (item instanceof IrConst c) {
            obj.addProperty(DEST, c.dest());
            obj.addProperty(OP, IrConst.OPCODE);
            obj.addProperty(TYPE, c.type());
            obj.add(VALUE, valueToTree(c.value()));
        } else if (item instanceof IrValueOp v) {
            obj.add(ARGS, strings(v.args()));
            obj.addProperty(DEST, v.dest());
            obj.addProperty(OP, v.op());
            obj.addProperty(TYPE, v.type());
        } else if (item instanceof IrEffectOp e) {
            obj.add(ARGS, strings(e.args()));
            obj.addProperty(OP, e.op());
        } else if (item instanceof IrLabelDef l) {
            obj.addProperty(LABEL, l.name());
        } else {
            throw new IllegalArgumentException("Unknown IR item: " + item);
        }
        return obj;
    }

    private static JsonPrimitive valueToTree(IrValue value) {
        if (value instanceof IrValue.Int64 i) {
            return new JsonPrimitive(i.value());
        }
        if (value instanceof IrValue.Bool b) {
            return new JsonPrimitive(b.value());
        }
        throw new IllegalArgumentException("Unknown IR value: " + value);
    }

    private static JsonArray strings(List<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    /**
     * Deserializes a program.
     *
     * @param json The JSON document.
     * @return The structured program.
     * @throws InterchangeFormatException if the document is not valid JSON or lacks a required key.
     */
    public IrProgram fromJson(String json) throws InterchangeFormatException {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new InterchangeFormatException("Malformed JSON program: " + e.getMessage(), e);
        }
        JsonObject program = asObject(root, "program");
        List<String> imports = program.has(IMPORTS) ? stringList(program, IMPORTS) : List.of();
        List<IrFunction> functions = new ArrayList<>();
        for (JsonElement f : requireArray(program, FUNCTIONS, "program")) {
            functions.add(functionFromTree(asObject(f, "function")));
        }
        return new IrProgram(imports, functions);
    }

    private IrFunction functionFromTree(JsonObject obj) throws InterchangeFormatException {
        String name = requireString(obj, NAME, "function");
        List<IrArg> args = new ArrayList<>();
        if (obj.has(ARGS)) {
            for (JsonElement a : requireArray(obj, ARGS, "function '" + name + "'")) {
                JsonObject arg = asObject(a, "argument of function '" + name + "'");
                args.add(new IrArg(requireString(arg, NAME, "argument"), optionalString(arg, TYPE)));
            }
        }
        List<IrItem> instrs = new ArrayList<>();
        for (JsonElement i : requireArray(obj, INSTRS, "function '" + name + "'")) {
            instrs.add(itemFromTree(asObject(i, "instruction in function '" + name + "'")));
        }
        return new IrFunction(name, args, optionalString(obj, TYPE), instrs);
    }

    private IrItem itemFromTree(JsonObject obj) throws InterchangeFormatException {
        if (obj.has(LABEL)) {
            return new IrLabelDef(requireString(obj, LABEL, "label"));
        }
        String op = requireString(obj, OP, "instruction");
        if (IrConst.OPCODE.equals(op) && obj.has(VALUE)) {
            return new IrConst(
                    requireString(obj, DEST, "const instruction"),
                    requireString(obj, TYPE, "const instruction"),
                    valueFromTree(obj.get(VALUE)));
        }
        List<String> args = obj.has(ARGS) ? stringList(obj, ARGS) : List.of();
        if (obj.has(DEST)) {
            return new IrValueOp(
                    requireString(obj, DEST, "instruction '" + op + "'"),
                    requireString(obj, TYPE, "instruction '" + op + "'"),
                    op,
                    args);
        }
        return new IrEffectOp(op, args);
    }

    private static IrValue valueFromTree(JsonElement value) throws InterchangeFormatException {
        if (value == null || !value.isJsonPrimitive()) {
            throw new InterchangeFormatException("Const instruction requires a literal 'value'.");
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return new IrValue.Bool(primitive.getAsBoolean());
        }
        if (primitive.isNumber()) {
            try {
                return new IrValue.Int64(Long.parseLong(primitive.getAsString()));
            } catch (NumberFormatException e) {
                throw new InterchangeFormatException("Const value is not a 64-bit integer: " + primitive.getAsString(), e);
            }
        }
        throw new InterchangeFormatException("Const value must be an integer or a boolean: " + primitive);
    }

    private static JsonObject asObject(JsonElement element, String what) throws InterchangeFormatException {
        if (element == null || !element.isJsonObject()) {
            throw new InterchangeFormatException("Expected a JSON object for " + what + ".");
        }
        return element.getAsJsonObject();
    }

    private static JsonArray requireArray(JsonObject obj, String key, String what) throws InterchangeFormatException {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonArray()) {
            throw new InterchangeFormatException("Missing array '" + key + "' in " + what + ".");
        }
        return element.getAsJsonArray();
    }

    private static String requireString(JsonObject obj, String key, String what) throws InterchangeFormatException {
        String value = optionalString(obj, key);
        if (value == null) {
            throw new InterchangeFormatException("Missing string '" + key + "' in " + what + ".");
        }
        return value;
    }

    private static String optionalString(JsonObject obj, String key) throws InterchangeFormatException {
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new InterchangeFormatException("Key '" + key + "' must be a string.");
        }
        return element.getAsString();
    }

    private static List<String> stringList(JsonObject obj, String key) throws InterchangeFormatException {
        List<String> values = new ArrayList<>();
        for (JsonElement element : requireArray(obj, key, "object")) {
            if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
                throw new InterchangeFormatException("Array '" + key + "' must contain only strings.");
            }
            values.add(element.getAsString());
        }
        return values;
    }
}
