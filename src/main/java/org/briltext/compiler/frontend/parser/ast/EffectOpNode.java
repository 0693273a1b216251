package org.briltext.compiler.frontend.parser.ast;

import org.briltext.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node for an operation executed only for its effect: {@code op arg...;}.
 *
 * @param opcode The operation name.
 * @param arguments The operand identifiers in textual order.
 */
public record EffectOpNode(
        Token opcode,
        List<IdentifierNode> arguments
) implements AstNode {

    public EffectOpNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public Token anchor() {
        return opcode;
    }
}
