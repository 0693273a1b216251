package org.briltext.compiler.ir;

/**
 * An element of a function body: one of the three instruction kinds or a label.
 */
public sealed interface IrItem permits IrConst, IrValueOp, IrEffectOp, IrLabelDef {
}
