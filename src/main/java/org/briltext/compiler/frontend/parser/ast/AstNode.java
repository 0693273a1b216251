package org.briltext.compiler.frontend.parser.ast;

import org.briltext.compiler.frontend.lexer.Token;

/**
 * The base interface for all nodes of the concrete parse tree.
 */
public interface AstNode {

    /**
     * Returns the token that best locates this node in the source, used for diagnostics.
     *
     * @return The representative token.
     */
    Token anchor();
}
