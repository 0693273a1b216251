package org.briltext.compiler.frontend.irgen;

import org.briltext.compiler.api.DuplicateFunctionException;
import org.briltext.compiler.diagnostics.DiagnosticsEngine;
import org.briltext.compiler.frontend.parser.ast.AstNode;
import org.briltext.compiler.ir.IrFunction;
import org.briltext.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Phase: Generates the structured program from the concrete parse tree by delegating to converters
 * resolved via the {@link IrConverterRegistry}, then rejects programs that define a function twice.
 */
public final class IrGenerator {

	private static final Logger LOG = LoggerFactory.getLogger(IrGenerator.class);

	private final DiagnosticsEngine diagnostics;
	private final IrConverterRegistry registry;

	/**
	 * Creates a new IR generator with a diagnostics engine and a prepared registry.
	 *
	 * @param diagnostics The diagnostics engine for reporting issues.
	 * @param registry    The converter registry.
	 */
	public IrGenerator(DiagnosticsEngine diagnostics, IrConverterRegistry registry) {
		this.diagnostics = diagnostics;
		this.registry = registry;
	}

	/**
	 * Generates a program by dispatching each top-level node to a converter.
	 *
	 * @param ast         The top-level nodes produced by the parser.
	 * @param programName The program name used for diagnostics.
	 * @return The generated program.
	 * @throws DuplicateFunctionException if a function name occurs more than once.
	 */
	public IrProgram generate(List<AstNode> ast, String programName) throws DuplicateFunctionException {
		IrGenContext ctx = new IrGenContext(programName, diagnostics, registry);
		for (AstNode node : ast) {
			registry.resolve(node).convert(node, ctx);
		}
		IrProgram program = ctx.build();

		List<String> duplicates = duplicateNames(program.functions());
		if (!duplicates.isEmpty()) {
			throw new DuplicateFunctionException(duplicates);
		}
		LOG.debug("Generated {} function(s) and {} import(s) for {}",
				program.functions().size(), program.imports().size(), programName);
		return program;
	}

	/**
	 * Lists every function name that occurs more than once, each once, in order of first repetition.
	 */
	private static List<String> duplicateNames(List<IrFunction> functions) {
		Set<String> unique = new HashSet<>();
		Set<String> duplicates = new LinkedHashSet<>();
		for (IrFunction function : functions) {
			if (!unique.add(function.name())) {
				duplicates.add(function.name());
			}
		}
		return new ArrayList<>(duplicates);
	}
}
