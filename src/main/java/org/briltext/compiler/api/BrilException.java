package org.briltext.compiler.api;

/**
 * Root of all failures raised while translating or resolving Bril programs.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class BrilException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    public BrilException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public BrilException(String message, Throwable cause) {
        super(message, cause);
    }
}
