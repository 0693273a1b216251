package org.briltext.compiler.frontend.parser.ast;

import org.briltext.compiler.frontend.lexer.Token;

/**
 * An AST node that represents an identifier used as an instruction operand.
 *
 * @param identifierToken The token of the identifier.
 */
public record IdentifierNode(
        Token identifierToken
) implements AstNode {

    @Override
    public Token anchor() {
        return identifierToken;
    }
}
