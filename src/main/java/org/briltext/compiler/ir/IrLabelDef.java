package org.briltext.compiler.ir;

/**
 * Label definition in a function body.
 */
public record IrLabelDef(String name) implements IrItem {}
