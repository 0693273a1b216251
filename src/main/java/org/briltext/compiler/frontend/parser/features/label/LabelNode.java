package org.briltext.compiler.frontend.parser.features.label;

import org.briltext.compiler.frontend.lexer.Token;
import org.briltext.compiler.frontend.parser.ast.AstNode;

/**
 * An AST node that represents a label definition (e.g., "loop:").
 * Unlike an instruction, a label is not terminated by a semicolon.
 *
 * @param labelToken The token containing the name of the label.
 */
public record LabelNode(
        Token labelToken
) implements AstNode {

    @Override
    public Token anchor() {
        return labelToken;
    }
}
