package org.briltext.compiler.frontend.irgen;

import org.briltext.compiler.frontend.lexer.Token;
import org.briltext.compiler.frontend.parser.ast.AstNode;

/**
 * Fallback converter used when no converter is registered for a node's class.
 * It emits nothing and reports an error, so the translation fails instead of silently dropping the node.
 */
public final class DefaultAstNodeToIrConverter implements IAstNodeToIrConverter<AstNode> {

	@Override
	public void convert(AstNode node, IrGenContext ctx) {
		Token anchor = node.anchor();
		ctx.diagnostics().reportError(
				"No converter registered for node type " + node.getClass().getSimpleName(),
				anchor != null ? anchor.fileName() : ctx.programName(),
				anchor != null ? anchor.line() : -1,
				anchor != null ? anchor.column() : -1
		);
	}
}
