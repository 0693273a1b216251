package org.briltext.compiler.ir;

/**
 * A function parameter.
 *
 * @param name The parameter name.
 * @param type The parameter type, or null for an untyped parameter.
 */
public record IrArg(String name, String type) {}
