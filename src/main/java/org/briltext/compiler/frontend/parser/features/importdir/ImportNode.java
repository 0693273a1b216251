package org.briltext.compiler.frontend.parser.features.importdir;

import org.briltext.compiler.frontend.lexer.Token;
import org.briltext.compiler.frontend.parser.ast.AstNode;

/**
 * An AST node for an {@code import name;} directive.
 *
 * @param keyword The {@code import} keyword token.
 * @param moduleName The token naming the imported module.
 */
public record ImportNode(
        Token keyword,
        Token moduleName
) implements AstNode {

    @Override
    public Token anchor() {
        return keyword;
    }
}
