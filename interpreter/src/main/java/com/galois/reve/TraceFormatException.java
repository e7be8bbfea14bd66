package com.galois.reve;

/**
 * TraceFormatException is thrown when a serialized trace cannot be decoded.
 */
public class TraceFormatException extends InterpreterFailedException {
    public TraceFormatException(String message) {
        super(message);
    }

    public TraceFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
