package org.briltext.compiler.frontend.irgen.converters;

import org.briltext.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.briltext.compiler.frontend.irgen.IrGenContext;
import org.briltext.compiler.frontend.parser.ast.ValueOpNode;
import org.briltext.compiler.ir.IrValueOp;

/**
 * Converts {@link ValueOpNode} into an {@link IrValueOp}.
 */
public final class ValueOpNodeConverter implements IAstNodeToIrConverter<ValueOpNode> {

	@Override
	public void convert(ValueOpNode node, IrGenContext ctx) {
		ctx.emit(new IrValueOp(
				node.dest().text(),
				node.type().typeToken().text(),
				node.opcode().text(),
				OperandNames.of(node.arguments())));
	}
}
