package org.briltext.compiler.ir;

/**
 * Literal values a constant instruction can load.
 */
public sealed interface IrValue permits IrValue.Int64, IrValue.Bool {

	/**
	 * Renders the value as it appears in the text format.
	 * @return The literal text, booleans in lower case.
	 */
	String toLiteral();

	/**
	 * Represents a 64-bit integer value.
	 * @param value The long value.
	 */
	record Int64(long value) implements IrValue {
		@Override
		public String toLiteral() {
			return Long.toString(value);
		}
	}

	/**
	 * Represents a boolean value.
	 * @param value The boolean value.
	 */
	record Bool(boolean value) implements IrValue {
		@Override
		public String toLiteral() {
			return Boolean.toString(value);
		}
	}
}
