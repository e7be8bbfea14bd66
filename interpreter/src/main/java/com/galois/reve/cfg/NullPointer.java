package com.galois.reve.cfg;

import com.galois.reve.Type;

/**
 * The null pointer constant.
 */
public final class NullPointer implements Expr {
    public static final NullPointer INSTANCE = new NullPointer();

    private NullPointer() {}

    public Type type() {
        return Type.POINTER;
    }

    public String getName() {
        return "null";
    }

    public String toString() {
        return "null";
    }
}
