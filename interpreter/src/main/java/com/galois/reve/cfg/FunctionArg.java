package com.galois.reve.cfg;

import com.galois.reve.Type;

/**
 * An argument to the function.
 */
public final class FunctionArg implements Expr {
    /** The id of the procedure that owns the argument. */
    final long procedureId;
    /** The index of the function argument. */
    final int index;
    /** The type of the argument. */
    final Type type;
    final String name;

    FunctionArg(long procedureId, int index, Type type, String name) {
        if (type == null) throw new NullPointerException("type");
        if (name == null) throw new NullPointerException("name");
        this.procedureId = procedureId;
        this.index = index;
        this.type  = type;
        this.name = name;
    }

    public Type type() {
        return this.type;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public String toString() {
        return name;
    }

    public boolean equals(Object o) {
        if (!(o instanceof FunctionArg)) return false;
        FunctionArg r = (FunctionArg) o;
        return procedureId == r.procedureId && index == r.index;
    }

    public int hashCode() {
        return (int) (procedureId * 31 + index);
    }
}
