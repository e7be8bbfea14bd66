package com.galois.reve;

/**
 * The two kinds of values a variable can hold.
 */
public enum ValueKind {
    INT,
    BOOL
}
