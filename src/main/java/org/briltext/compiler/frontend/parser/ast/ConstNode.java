package org.briltext.compiler.frontend.parser.ast;

import org.briltext.compiler.frontend.lexer.Token;

/**
 * An AST node for {@code dest: type = const literal;}.
 *
 * @param dest The destination variable.
 * @param type The declared type.
 * @param value The literal value.
 */
public record ConstNode(
        Token dest,
        TypeNode type,
        LiteralNode value
) implements AstNode {

    @Override
    public Token anchor() {
        return dest;
    }
}
