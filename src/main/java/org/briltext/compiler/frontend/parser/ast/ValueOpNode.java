package org.briltext.compiler.frontend.parser.ast;

import org.briltext.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node for an operation that writes a result: {@code dest: type = op arg...;}.
 *
 * @param dest The destination variable.
 * @param type The declared result type.
 * @param opcode The operation name.
 * @param arguments The operand identifiers in textual order.
 */
public record ValueOpNode(
        Token dest,
        TypeNode type,
        Token opcode,
        List<IdentifierNode> arguments
) implements AstNode {

    public ValueOpNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public Token anchor() {
        return dest;
    }
}
