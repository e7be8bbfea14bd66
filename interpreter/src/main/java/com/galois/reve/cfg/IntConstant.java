package com.galois.reve.cfg;

import java.math.BigInteger;

import com.galois.reve.BitvectorValue;
import com.galois.reve.Type;

/**
 * An integer literal of a fixed width.  Literals of width one are Booleans.
 * The value is kept as the signed integer with the same low
 * <code>width</code> bits, so <code>255</code> at width 8 is <code>-1</code>.
 */
public final class IntConstant implements Expr {
    private final Type type;
    private final BigInteger value;

    public IntConstant(long width, BigInteger value) {
        if (value == null) throw new NullPointerException("value");
        this.type = Type.integer(width);
        this.value = width == 1
            ? (value.testBit(0) ? BigInteger.ONE : BigInteger.ZERO)
            : new BitvectorValue(width, value).toSignedBigInteger();
    }

    public IntConstant(long width, long value) {
        this(width, BigInteger.valueOf(value));
    }

    public Type type() {
        return type;
    }

    public long getWidth() {
        return type.getWidth();
    }

    /**
     * Return the signed value of the literal.
     * @return the value
     */
    public BigInteger getValue() {
        return value;
    }

    public String getName() {
        return value.toString();
    }

    public String toString() {
        return type + " " + value;
    }

    public boolean equals(Object o) {
        if (!(o instanceof IntConstant)) return false;
        IntConstant r = (IntConstant) o;
        return type.equals(r.type) && value.equals(r.value);
    }

    public int hashCode() {
        return type.hashCode() ^ value.hashCode();
    }
}
