package com.galois.reve.cfg;

import com.galois.reve.Type;

/**
 * Stands for the return value of the function being interpreted.  A return
 * terminator binds it; it is recorded under the name <code>"return"</code>.
 */
public final class ReturnValue implements Expr {
    public static final String NAME = "return";

    public static final ReturnValue INSTANCE = new ReturnValue();

    private ReturnValue() {}

    public Type type() {
        return Type.VOID;
    }

    public String getName() {
        return NAME;
    }

    public String toString() {
        return NAME;
    }
}
