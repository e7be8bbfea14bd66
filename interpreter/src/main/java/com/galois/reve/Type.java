package com.galois.reve;

import java.util.HashMap;
import java.util.Map;

/**
 * IR types: fixed-width integers, pointers and void.
 *
 * <p>
 * Booleans are integers of width one.  Pointers are 64 bits wide.
 */
public final class Type {
    /** The kind of a type. */
    public enum Kind { INTEGER, POINTER, VOID }

    final Kind kind;
    final long width;

    private Type(Kind kind, long width) {
        this.kind = kind;
        this.width = width;
    }

    /**
     * Type of functions that return nothing.
     */
    public static final Type VOID = new Type(Kind.VOID, 0);

    /**
     * Type of addresses.
     */
    public static final Type POINTER = new Type(Kind.POINTER, 64);

    // Cache used for integer types.
    private static Map<Long,Type> integerTypes = new HashMap<Long,Type>();

    /**
     * Returns the type of an integer with <code>width</code> bits.
     *
     * @param width The number of bits in the integer.
     * @return The given type.
     */
    public static Type integer(long width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Integer width must be positive: " + width);
        }
        synchronized (integerTypes) {
            Type r = integerTypes.get(width);
            if (r == null) {
                r = new Type(Kind.INTEGER, width);
                integerTypes.put(width, r);
            }
            return r;
        }
    }

    /**
     * Type for Boolean values (true or false).
     */
    public static final Type BOOL = integer(1);

    public Kind getKind() {
        return kind;
    }

    /**
     * Return the number of bits in a value of this type; zero for void.
     * @return the width
     */
    public long getWidth() {
        return width;
    }

    public boolean isInteger() {
        return kind == Kind.INTEGER;
    }

    public boolean isBool() {
        return kind == Kind.INTEGER && width == 1;
    }

    public boolean isPointer() {
        return kind == Kind.POINTER;
    }

    public boolean isVoid() {
        return kind == Kind.VOID;
    }

    /**
     * Returns whether values of this type are integers at runtime, that is
     * integers wider than one bit or pointers.
     */
    public boolean isIntLike() {
        return (kind == Kind.INTEGER && width > 1) || kind == Kind.POINTER;
    }

    public String toString() {
        switch (kind) {
        case INTEGER:
            return "i" + width;
        case POINTER:
            return "ptr";
        default:
            return "void";
        }
    }

    public boolean equals(Object o) {
        if (!(o instanceof Type)) return false;
        Type r = (Type) o;
        return kind == r.kind && width == r.width;
    }

    public int hashCode() {
        return kind.hashCode() * 31 + (int) width;
    }
}
