package org.briltext.compiler.frontend.irgen;

import org.briltext.compiler.diagnostics.DiagnosticsEngine;
import org.briltext.compiler.frontend.parser.ast.AstNode;
import org.briltext.compiler.ir.IrArg;
import org.briltext.compiler.ir.IrFunction;
import org.briltext.compiler.ir.IrItem;
import org.briltext.compiler.ir.IrProgram;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context passed to converters during IR generation.
 * Collects imports and functions; body items are emitted into the function that is currently open.
 */
public final class IrGenContext {

	private final String programName;
	private final DiagnosticsEngine diagnostics;
	private final IrConverterRegistry registry;
	private final List<String> imports = new ArrayList<>();
	private final List<IrFunction> functions = new ArrayList<>();

	private String functionName;
	private List<IrArg> functionArgs;
	private String functionReturnType;
	private List<IrItem> functionBody;

	/**
	 * Constructs a new IR generation context.
	 * @param programName The name of the program being converted.
	 * @param diagnostics The diagnostics engine for reporting errors and warnings.
	 * @param registry The registry for resolving AST node converters.
	 */
	public IrGenContext(String programName, DiagnosticsEngine diagnostics, IrConverterRegistry registry) {
		this.programName = programName;
		this.diagnostics = diagnostics;
		this.registry = registry;
	}

	/**
	 * Records an imported module name.
	 * @param moduleName The bare module name.
	 */
	public void addImport(String moduleName) {
		imports.add(moduleName);
	}

	/**
	 * Opens a function; subsequent {@link #emit(IrItem)} calls append to its body.
	 * @param name The function name.
	 * @param args The parameters.
	 * @param returnType The return type, or null.
	 */
	public void beginFunction(String name, List<IrArg> args, String returnType) {
		if (functionBody != null) {
			throw new IllegalStateException("Function '" + functionName + "' is still open.");
		}
		this.functionName = name;
		this.functionArgs = args;
		this.functionReturnType = returnType;
		this.functionBody = new ArrayList<>();
	}

	/**
	 * Emits a body item into the open function.
	 * @param item The instruction or label.
	 */
	public void emit(IrItem item) {
		if (functionBody == null) {
			throw new IllegalStateException("Cannot emit " + item + " outside of a function.");
		}
		functionBody.add(item);
	}

	/**
	 * Closes the open function and appends it to the program.
	 */
	public void endFunction() {
		if (functionBody == null) {
			throw new IllegalStateException("No function is open.");
		}
		functions.add(new IrFunction(functionName, functionArgs, functionReturnType, functionBody));
		functionName = null;
		functionArgs = null;
		functionReturnType = null;
		functionBody = null;
	}

	/**
	 * Converts the given AST node by resolving and invoking the appropriate converter.
	 * @param node The node to convert.
	 */
	public void convert(AstNode node) {
		registry.resolve(node).convert(node, this);
	}

	/**
	 * @return The diagnostics engine.
	 */
	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public String programName() {
		return programName;
	}

	/**
	 * Builds the final {@link IrProgram} from the collected imports and functions.
	 * @return The constructed program.
	 */
	public IrProgram build() {
		return new IrProgram(imports, functions);
	}
}
