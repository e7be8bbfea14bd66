package com.galois.reve;

import java.math.BigInteger;

/**
 * A fixed-width two's complement integer.
 *
 * The bits are kept as a non-negative integer below <code>2^width</code>;
 * every operation wraps around modulo <code>2^width</code>.
 */
public final class BitvectorValue extends IntValue {
    private final long width;
    private final BigInteger v;

    /**
     * Create a bitvector.  <code>v</code> may be negative or too large; it is
     * reduced modulo <code>2^width</code>.
     * @param width number of bits, at least one
     * @param v the value
     */
    public BitvectorValue(long width, BigInteger v) {
        if (v == null) throw new NullPointerException("v");
        if (width <= 0) {
            throw new IllegalArgumentException("Bitvector width must be positive: " + width);
        }
        this.width = width;
        this.v = v.signum() >= 0 && v.bitLength() <= width ? v : v.and(mask(width));
    }

    public BitvectorValue(long width, long v) {
        this(width, BigInteger.valueOf(v));
    }

    private static BigInteger mask(long width) {
        return BigInteger.ONE.shiftLeft((int) width).subtract(BigInteger.ONE);
    }

    /**
     * Return the number of bits.
     * @return the width
     */
    public long getWidth() {
        return width;
    }

    /**
     * Return the bits as a non-negative integer.
     * @return the value
     */
    public BigInteger getValue() {
        return v;
    }

    public boolean isBounded() {
        return true;
    }

    public BigInteger toSignedBigInteger() {
        if (v.testBit((int) width - 1)) {
            return v.subtract(BigInteger.ONE.shiftLeft((int) width));
        }
        return v;
    }

    public BigInteger toUnsignedBigInteger() {
        return v;
    }

    @Override
    long bitWidth() {
        return width;
    }

    // Check o is a bitvector with the same width as this.
    private BitvectorValue operand(IntValue o) {
        if (!(o instanceof BitvectorValue)) {
            throw modeMismatch(this, o);
        }
        BitvectorValue r = (BitvectorValue) o;
        if (r.width != width) {
            String msg = String.format("Bitvector width mismatch: %d and %d", width, r.width);
            throw new InterpreterFailedException(msg);
        }
        return r;
    }

    private BitvectorValue make(BigInteger x) {
        return new BitvectorValue(width, x);
    }

    // Shift amounts at or beyond the width are clamped to the width.
    private int shiftAmount(BitvectorValue r) {
        if (r.v.compareTo(BigInteger.valueOf(width)) >= 0) {
            return (int) width;
        }
        return r.v.intValue();
    }

    public IntValue add(IntValue o) {
        return make(v.add(operand(o).v));
    }

    public IntValue sub(IntValue o) {
        return make(v.subtract(operand(o).v));
    }

    public IntValue mul(IntValue o) {
        return make(v.multiply(operand(o).v));
    }

    public IntValue sdiv(IntValue o) {
        BitvectorValue r = operand(o);
        if (r.v.signum() == 0) throw divisionByZero();
        return make(toSignedBigInteger().divide(r.toSignedBigInteger()));
    }

    public IntValue udiv(IntValue o) {
        BitvectorValue r = operand(o);
        if (r.v.signum() == 0) throw divisionByZero();
        return make(v.divide(r.v));
    }

    public IntValue srem(IntValue o) {
        BitvectorValue r = operand(o);
        if (r.v.signum() == 0) throw divisionByZero();
        return make(toSignedBigInteger().remainder(r.toSignedBigInteger()));
    }

    public IntValue urem(IntValue o) {
        BitvectorValue r = operand(o);
        if (r.v.signum() == 0) throw divisionByZero();
        return make(v.remainder(r.v));
    }

    public IntValue shl(IntValue o) {
        int n = shiftAmount(operand(o));
        if (n >= width) {
            return make(BigInteger.ZERO);
        }
        return make(v.shiftLeft(n));
    }

    public IntValue lshr(IntValue o) {
        int n = shiftAmount(operand(o));
        if (n >= width) {
            return make(BigInteger.ZERO);
        }
        return make(v.shiftRight(n));
    }

    public IntValue ashr(IntValue o) {
        int n = shiftAmount(operand(o));
        return make(toSignedBigInteger().shiftRight(n));
    }

    public IntValue and(IntValue o) {
        return make(v.and(operand(o).v));
    }

    public IntValue or(IntValue o) {
        return make(v.or(operand(o).v));
    }

    public IntValue xor(IntValue o) {
        return make(v.xor(operand(o).v));
    }

    public boolean eq(IntValue o) {
        return v.equals(operand(o).v);
    }

    public boolean sge(IntValue o) {
        return toSignedBigInteger().compareTo(operand(o).toSignedBigInteger()) >= 0;
    }

    public boolean sgt(IntValue o) {
        return toSignedBigInteger().compareTo(operand(o).toSignedBigInteger()) > 0;
    }

    public boolean uge(IntValue o) {
        return v.compareTo(operand(o).v) >= 0;
    }

    public boolean ugt(IntValue o) {
        return v.compareTo(operand(o).v) > 0;
    }

    public IntValue zext(long newWidth) {
        if (newWidth < width) {
            throw new InterpreterFailedException(
                String.format("Cannot zero extend %d bits to %d bits", width, newWidth));
        }
        return new BitvectorValue(newWidth, v);
    }

    public IntValue sext(long newWidth) {
        if (newWidth < width) {
            throw new InterpreterFailedException(
                String.format("Cannot sign extend %d bits to %d bits", width, newWidth));
        }
        return new BitvectorValue(newWidth, toSignedBigInteger());
    }

    public IntValue trunc(long newWidth) {
        if (newWidth > width) {
            throw new InterpreterFailedException(
                String.format("Cannot truncate %d bits to %d bits", width, newWidth));
        }
        return new BitvectorValue(newWidth, v);
    }

    public IntValue zextOrTrunc(long newWidth) {
        if (newWidth == width) {
            return this;
        }
        return new BitvectorValue(newWidth, v);
    }

    public IntValue asPointer() {
        return zextOrTrunc(64);
    }

    public String toString() {
        return "0x" + v.toString(16) + ":[" + String.valueOf(width) + "]";
    }

    public boolean equals(Object o) {
        if (!(o instanceof BitvectorValue)) return false;
        BitvectorValue r = (BitvectorValue) o;
        return (width == r.width) && v.equals(r.v);
    }

    public int hashCode() {
        return ((int) width) ^ v.hashCode();
    }
}
