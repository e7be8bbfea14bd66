package com.galois.reve;

import java.math.BigInteger;

/**
 * An integer manipulated by the interpreter.
 *
 * <p>
 * There are two implementations: {@link BitvectorValue} for fixed-width two's
 * complement integers and {@link IntegerValue} for arbitrary precision
 * integers.  Both provide the same operations so the interpreter can be
 * written once for either mode.  Operands of a binary operation must come
 * from the same implementation (and, for bitvectors, have the same width);
 * otherwise an {@link InterpreterFailedException} is thrown.
 */
public abstract class IntValue implements Comparable<IntValue> {
    IntValue() {}

    /**
     * Returns whether this is a fixed-width integer.
     * @return true for bitvectors
     */
    public abstract boolean isBounded();

    /**
     * Return the value interpreted as a signed integer.
     * @return the signed value
     */
    public abstract BigInteger toSignedBigInteger();

    /**
     * Return the value interpreted as an unsigned integer.  For unbounded
     * integers this is the same as the signed value.
     * @return the unsigned value
     */
    public abstract BigInteger toUnsignedBigInteger();

    /** Returns whether the value is zero. */
    public boolean isZero() {
        return toSignedBigInteger().signum() == 0;
    }

    public abstract IntValue add(IntValue o);
    public abstract IntValue sub(IntValue o);
    public abstract IntValue mul(IntValue o);
    public abstract IntValue sdiv(IntValue o);
    public abstract IntValue udiv(IntValue o);
    public abstract IntValue srem(IntValue o);
    public abstract IntValue urem(IntValue o);
    public abstract IntValue shl(IntValue o);
    public abstract IntValue lshr(IntValue o);
    public abstract IntValue ashr(IntValue o);
    public abstract IntValue and(IntValue o);
    public abstract IntValue or(IntValue o);
    public abstract IntValue xor(IntValue o);

    public abstract boolean eq(IntValue o);
    public abstract boolean sge(IntValue o);
    public abstract boolean sgt(IntValue o);
    public abstract boolean uge(IntValue o);
    public abstract boolean ugt(IntValue o);

    public boolean ne(IntValue o) {
        return !eq(o);
    }

    public boolean sle(IntValue o) {
        return !sgt(o);
    }

    public boolean slt(IntValue o) {
        return !sge(o);
    }

    public boolean ule(IntValue o) {
        return !ugt(o);
    }

    public boolean ult(IntValue o) {
        return !uge(o);
    }

    /**
     * Zero extend to <code>width</code> bits.
     * @param width the new width, at least the current one
     * @return the extended value
     */
    public abstract IntValue zext(long width);

    /**
     * Sign extend to <code>width</code> bits.
     * @param width the new width, at least the current one
     * @return the extended value
     */
    public abstract IntValue sext(long width);

    /**
     * Truncate to the low <code>width</code> bits.
     * @param width the new width, at most the current one
     * @return the truncated value
     */
    public abstract IntValue trunc(long width);

    /**
     * Zero extend or truncate to <code>width</code> bits, whichever applies.
     * @param width the new width
     * @return the converted value
     */
    public abstract IntValue zextOrTrunc(long width);

    /**
     * Interpret this integer as a heap address.  Bitvectors are converted to
     * 64 bits; unbounded integers are returned unchanged.
     * @return the address
     */
    public abstract IntValue asPointer();

    /**
     * Orders integers by signed value; bitvectors of equal value are ordered
     * by width.
     */
    public int compareTo(IntValue o) {
        int c = toSignedBigInteger().compareTo(o.toSignedBigInteger());
        if (c != 0) {
            return c;
        }
        return Long.compare(bitWidth(), o.bitWidth());
    }

    /** Width used for ordering; zero for unbounded integers. */
    long bitWidth() {
        return 0;
    }

    static InterpreterFailedException modeMismatch(IntValue x, IntValue y) {
        return new InterpreterFailedException(
            String.format("Cannot mix bounded and unbounded integers: %s and %s", x, y));
    }

    static InterpreterFailedException divisionByZero() {
        return new InterpreterFailedException("Integer division or remainder by zero.");
    }
}
