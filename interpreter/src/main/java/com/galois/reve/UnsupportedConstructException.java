package com.galois.reve;

/**
 * UnsupportedConstructException is thrown when the interpreter meets an
 * instruction, predicate or operator it has no semantics for.
 */
public class UnsupportedConstructException extends InterpreterFailedException {
    public UnsupportedConstructException(String message) {
        super(message);
    }
}
