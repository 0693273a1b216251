package org.briltext.compiler.frontend.parser.ast;

/**
 * A literal operand of a {@code const} instruction.
 */
public sealed interface LiteralNode extends AstNode permits NumberLiteralNode, BooleanLiteralNode {
}
