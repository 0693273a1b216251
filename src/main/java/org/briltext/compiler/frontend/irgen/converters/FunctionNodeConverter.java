package org.briltext.compiler.frontend.irgen.converters;

import org.briltext.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.briltext.compiler.frontend.irgen.IrGenContext;
import org.briltext.compiler.frontend.parser.ast.ArgNode;
import org.briltext.compiler.frontend.parser.ast.AstNode;
import org.briltext.compiler.frontend.parser.features.function.FunctionNode;
import org.briltext.compiler.ir.IrArg;
import org.briltext.compiler.ir.IrFunction;

import java.util.List;

/**
 * Converts {@link FunctionNode} into an {@link IrFunction}, separating the parameters
 * and the optional return type from the body, which is converted item by item.
 */
public final class FunctionNodeConverter implements IAstNodeToIrConverter<FunctionNode> {

	@Override
	public void convert(FunctionNode node, IrGenContext ctx) {
		List<IrArg> args = node.parameters().stream()
				.map(FunctionNodeConverter::toArg)
				.toList();
		String returnType = node.returnType() != null ? node.returnType().typeToken().text() : null;

		ctx.beginFunction(node.name().text(), args, returnType);
		for (AstNode item : node.body()) {
			ctx.convert(item);
		}
		ctx.endFunction();
	}

	private static IrArg toArg(ArgNode arg) {
		return new IrArg(arg.name().text(), arg.type() != null ? arg.type().typeToken().text() : null);
	}
}
