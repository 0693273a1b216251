package org.briltext.compiler.frontend.irgen.converters;

import org.briltext.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.briltext.compiler.frontend.irgen.IrGenContext;
import org.briltext.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.briltext.compiler.frontend.parser.ast.ConstNode;
import org.briltext.compiler.frontend.parser.ast.LiteralNode;
import org.briltext.compiler.frontend.parser.ast.NumberLiteralNode;
import org.briltext.compiler.ir.IrConst;
import org.briltext.compiler.ir.IrValue;

/**
 * Converts {@link ConstNode} into an {@link IrConst}, turning the literal into a native value.
 */
public final class ConstNodeConverter implements IAstNodeToIrConverter<ConstNode> {

	@Override
	public void convert(ConstNode node, IrGenContext ctx) {
		ctx.emit(new IrConst(node.dest().text(), node.type().typeToken().text(), toValue(node.value())));
	}

	private static IrValue toValue(LiteralNode literal) {
		if (literal instanceof NumberLiteralNode n) {
			return new IrValue.Int64(n.getValue());
		}
		if (literal instanceof BooleanLiteralNode b) {
			return new IrValue.Bool(b.getValue());
		}
		throw new IllegalStateException("Unknown literal node: " + literal);
	}
}
