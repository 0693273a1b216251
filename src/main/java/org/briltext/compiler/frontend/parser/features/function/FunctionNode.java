package org.briltext.compiler.frontend.parser.features.function;

import org.briltext.compiler.frontend.lexer.Token;
import org.briltext.compiler.frontend.parser.ast.ArgNode;
import org.briltext.compiler.frontend.parser.ast.AstNode;
import org.briltext.compiler.frontend.parser.ast.TypeNode;

import java.util.List;

/**
 * An AST node for a function definition.
 *
 * @param name The token of the function name.
 * @param parameters The declared parameters in order.
 * @param returnType The return type, or null if the function declares none.
 * @param body The instructions and labels of the body in source order.
 */
public record FunctionNode(
        Token name,
        List<ArgNode> parameters,
        TypeNode returnType,
        List<AstNode> body
) implements AstNode {

    public FunctionNode {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public Token anchor() {
        return name;
    }
}
