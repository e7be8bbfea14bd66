package com.galois.reve;

import java.math.BigInteger;

/**
 * An arbitrary precision integer.
 *
 * Signed and unsigned variants of division, remainder and comparison
 * coincide, and width conversions return the value unchanged.
 */
public final class IntegerValue extends IntValue {
    public static final IntegerValue ZERO = new IntegerValue(BigInteger.ZERO);

    private final BigInteger v;

    public IntegerValue(long i) {
        this.v = BigInteger.valueOf(i);
    }

    public IntegerValue(BigInteger i) {
        if (i == null) throw new NullPointerException("i");
        this.v = i;
    }

    /**
     * Return the value.
     * @return the value
     */
    public BigInteger getValue() {
        return v;
    }

    public boolean isBounded() {
        return false;
    }

    public BigInteger toSignedBigInteger() {
        return v;
    }

    public BigInteger toUnsignedBigInteger() {
        return v;
    }

    private BigInteger operand(IntValue o) {
        if (!(o instanceof IntegerValue)) {
            throw modeMismatch(this, o);
        }
        return ((IntegerValue) o).v;
    }

    private static int shiftAmount(BigInteger n) {
        if (n.signum() < 0 || n.bitLength() > 31) {
            throw new InterpreterFailedException("Shift amount out of range: " + n);
        }
        return n.intValue();
    }

    public IntValue add(IntValue o) {
        return new IntegerValue(v.add(operand(o)));
    }

    public IntValue sub(IntValue o) {
        return new IntegerValue(v.subtract(operand(o)));
    }

    public IntValue mul(IntValue o) {
        return new IntegerValue(v.multiply(operand(o)));
    }

    public IntValue sdiv(IntValue o) {
        BigInteger r = operand(o);
        if (r.signum() == 0) throw divisionByZero();
        return new IntegerValue(v.divide(r));
    }

    public IntValue udiv(IntValue o) {
        return sdiv(o);
    }

    public IntValue srem(IntValue o) {
        BigInteger r = operand(o);
        if (r.signum() == 0) throw divisionByZero();
        return new IntegerValue(v.remainder(r));
    }

    public IntValue urem(IntValue o) {
        return srem(o);
    }

    public IntValue shl(IntValue o) {
        return new IntegerValue(v.shiftLeft(shiftAmount(operand(o))));
    }

    public IntValue lshr(IntValue o) {
        return new IntegerValue(v.shiftRight(shiftAmount(operand(o))));
    }

    public IntValue ashr(IntValue o) {
        return lshr(o);
    }

    public IntValue and(IntValue o) {
        return new IntegerValue(v.and(operand(o)));
    }

    public IntValue or(IntValue o) {
        return new IntegerValue(v.or(operand(o)));
    }

    public IntValue xor(IntValue o) {
        return new IntegerValue(v.xor(operand(o)));
    }

    public boolean eq(IntValue o) {
        return v.equals(operand(o));
    }

    public boolean sge(IntValue o) {
        return v.compareTo(operand(o)) >= 0;
    }

    public boolean sgt(IntValue o) {
        return v.compareTo(operand(o)) > 0;
    }

    public boolean uge(IntValue o) {
        return sge(o);
    }

    public boolean ugt(IntValue o) {
        return sgt(o);
    }

    public IntValue zext(long width) {
        return this;
    }

    public IntValue sext(long width) {
        return this;
    }

    public IntValue trunc(long width) {
        return this;
    }

    public IntValue zextOrTrunc(long width) {
        return this;
    }

    public IntValue asPointer() {
        return this;
    }

    public boolean equals(Object o) {
        if (!(o instanceof IntegerValue)) return false;
        return v.equals(((IntegerValue) o).v);
    }

    /**
     * Returns hash code of integer.
     */
    public int hashCode() {
        return v.hashCode();
    }

    /**
     * Returns decimal representation of string.
     */
    public String toString() {
        return v.toString();
    }
}
