package org.briltext.compiler.api;

/**
 * Thrown when a JSON document is not a well-formed Bril program.
 */
public class InterchangeFormatException extends BrilException {

    public InterchangeFormatException(String message) {
        super(message);
    }

    public InterchangeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
