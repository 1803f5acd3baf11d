package com.helios.transform.core.compiler;

/**
 * Exception thrown when a rule source cannot be compiled into a rule set.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the codebase, while still providing clear error messages
 * for load failures. It is never thrown while transforming a document.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
