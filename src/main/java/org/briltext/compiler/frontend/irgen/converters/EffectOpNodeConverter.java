package org.briltext.compiler.frontend.irgen.converters;

import org.briltext.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.briltext.compiler.frontend.irgen.IrGenContext;
import org.briltext.compiler.frontend.parser.ast.EffectOpNode;
import org.briltext.compiler.ir.IrEffectOp;

/**
 * Converts {@link EffectOpNode} into an {@link IrEffectOp}.
 */
public final class EffectOpNodeConverter implements IAstNodeToIrConverter<EffectOpNode> {

	@Override
	public void convert(EffectOpNode node, IrGenContext ctx) {
		ctx.emit(new IrEffectOp(node.opcode().text(), OperandNames.of(node.arguments())));
	}
}
