package org.briltext.compiler.frontend.irgen.converters;

import org.briltext.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.briltext.compiler.frontend.irgen.IrGenContext;
import org.briltext.compiler.frontend.parser.features.importdir.ImportNode;

/**
 * Converts {@link ImportNode} into the bare module name recorded on the program.
 */
public final class ImportNodeConverter implements IAstNodeToIrConverter<ImportNode> {

	@Override
	public void convert(ImportNode node, IrGenContext ctx) {
		ctx.addImport(node.moduleName().text());
	}
}
