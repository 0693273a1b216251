package org.briltext.compiler.frontend.irgen.converters;

import org.briltext.compiler.frontend.parser.ast.IdentifierNode;

import java.util.List;

final class OperandNames {

	private OperandNames() {}

	static List<String> of(List<IdentifierNode> arguments) {
		return arguments.stream()
				.map(arg -> arg.identifierToken().text())
				.toList();
	}
}
