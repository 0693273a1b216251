package org.briltext.compiler.frontend.irgen;

import org.briltext.compiler.frontend.irgen.converters.ConstNodeConverter;
import org.briltext.compiler.frontend.irgen.converters.EffectOpNodeConverter;
import org.briltext.compiler.frontend.irgen.converters.FunctionNodeConverter;
import org.briltext.compiler.frontend.irgen.converters.ImportNodeConverter;
import org.briltext.compiler.frontend.irgen.converters.LabelNodeConverter;
import org.briltext.compiler.frontend.irgen.converters.ValueOpNodeConverter;
import org.briltext.compiler.frontend.parser.ast.AstNode;
import org.briltext.compiler.frontend.parser.ast.ConstNode;
import org.briltext.compiler.frontend.parser.ast.EffectOpNode;
import org.briltext.compiler.frontend.parser.ast.ValueOpNode;
import org.briltext.compiler.frontend.parser.features.function.FunctionNode;
import org.briltext.compiler.frontend.parser.features.importdir.ImportNode;
import org.briltext.compiler.frontend.parser.features.label.LabelNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry mapping parse-tree node classes to converter instances.
 * <p>
 * Node types are records, so converters are looked up by the node's exact class;
 * anything unregistered goes to the default converter.
 */
public final class IrConverterRegistry {

	private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> byClass = new HashMap<>();
	private final IAstNodeToIrConverter<AstNode> defaultConverter;

	private IrConverterRegistry(IAstNodeToIrConverter<AstNode> defaultConverter) {
		this.defaultConverter = defaultConverter;
	}

	/**
	 * Registers a converter for the given AST node class.
	 *
	 * @param nodeType  The concrete AST node class.
	 * @param converter The converter instance handling that class.
	 * @param <T>       Concrete AST type parameter.
	 */
	public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
		byClass.put(nodeType, converter);
	}

	/**
	 * Resolves the converter registered for the node's class, or the default converter.
	 *
	 * @param node The AST node instance to resolve a converter for.
	 * @return A non-null converter to handle the node.
	 */
	@SuppressWarnings("unchecked")
	public IAstNodeToIrConverter<AstNode> resolve(AstNode node) {
		IAstNodeToIrConverter<?> found = byClass.get(node.getClass());
		return found != null ? (IAstNodeToIrConverter<AstNode>) found : defaultConverter;
	}

	/**
	 * Creates a registry instance with the given default converter and no specific converters.
	 *
	 * @param defaultConverter The fallback converter used for unknown node types.
	 * @return A new registry instance.
	 */
	public static IrConverterRegistry initialize(IAstNodeToIrConverter<AstNode> defaultConverter) {
		return new IrConverterRegistry(defaultConverter);
	}

	/**
	 * Initializes a registry with the default converter and one converter per parse-tree node kind.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize(new DefaultAstNodeToIrConverter());
		reg.register(ImportNode.class, new ImportNodeConverter());
		reg.register(FunctionNode.class, new FunctionNodeConverter());
		reg.register(ConstNode.class, new ConstNodeConverter());
		reg.register(ValueOpNode.class, new ValueOpNodeConverter());
		reg.register(EffectOpNode.class, new EffectOpNodeConverter());
		reg.register(LabelNode.class, new LabelNodeConverter());
		return reg;
	}
}
