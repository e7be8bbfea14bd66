package com.galois.reve;

/**
 * InterpreterFailedException is thrown when the interpreter is handed a
 * program or trace that violates its preconditions.  It aborts the entire
 * interpretation.
 */
public class InterpreterFailedException extends RuntimeException {
    public InterpreterFailedException(String message) {
        super(message);
    }

    public InterpreterFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
