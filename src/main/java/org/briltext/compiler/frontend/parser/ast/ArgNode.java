package org.briltext.compiler.frontend.parser.ast;

import org.briltext.compiler.frontend.lexer.Token;

/**
 * An AST node for a function parameter, either bare ({@code n}) or typed ({@code (n: int)}).
 *
 * @param name The token of the parameter name.
 * @param type The type annotation, or null for a bare parameter.
 */
public record ArgNode(
        Token name,
        TypeNode type
) implements AstNode {

    @Override
    public Token anchor() {
        return name;
    }
}
