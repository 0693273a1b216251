package org.briltext.compiler.frontend.irgen.converters;

import org.briltext.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.briltext.compiler.frontend.irgen.IrGenContext;
import org.briltext.compiler.frontend.parser.features.label.LabelNode;
import org.briltext.compiler.ir.IrLabelDef;

/**
 * Converts {@link LabelNode} into {@link IrLabelDef}.
 */
public final class LabelNodeConverter implements IAstNodeToIrConverter<LabelNode> {

	@Override
	public void convert(LabelNode node, IrGenContext ctx) {
		ctx.emit(new IrLabelDef(node.labelToken().text()));
	}
}
