package com.galois.reve;

import java.math.BigInteger;

import com.galois.reve.proto.Protos;

/**
 * Options for one interpretation run.
 *
 * <p>
 * A run is either bounded (fixed-width two's complement integers, byte
 * granular heap) or unbounded (arbitrary precision integers, one heap cell per
 * value).  The configuration is immutable and is handed to the
 * {@link Interpreter} and the {@link Heap} explicitly, so bounded and
 * unbounded runs can coexist in one process.
 */
public final class RunConfig {
    /** System property selecting bounded mode. */
    public static final String BOUNDED_PROPERTY = "reve.bounded";

    /** System property giving the heap element size in bits. */
    public static final String HEAP_ELEM_SIZE_PROPERTY = "reve.heapElemSize";

    static final int DEFAULT_HEAP_ELEM_SIZE = 8;

    private final Protos.RunOptions opts;

    private RunConfig(Protos.RunOptions opts) {
        this.opts = opts;
    }

    /**
     * Return a configuration for bounded integers with the default heap
     * element size.
     */
    public static RunConfig bounded() {
        return newBuilder().setBounded(true).build();
    }

    /**
     * Return a configuration for unbounded integers.
     */
    public static RunConfig unbounded() {
        return newBuilder().setBounded(false).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Create a configuration from its protocol buffer representation.  A heap
     * element size of zero selects the default.
     */
    public static RunConfig fromProto(Protos.RunOptions rep) {
        Builder b = newBuilder().setBounded(rep.getBounded());
        if (rep.getHeapElemSize() != 0) {
            b.setHeapElemSize(rep.getHeapElemSize());
        }
        return b.build();
    }

    /**
     * Create a configuration from the <code>reve.bounded</code> and
     * <code>reve.heapElemSize</code> system properties.  Missing properties
     * take their defaults.
     */
    public static RunConfig fromSystemProperties() {
        Builder b = newBuilder();
        String bounded = System.getProperty(BOUNDED_PROPERTY);
        if (bounded != null) {
            b.setBounded(Boolean.parseBoolean(bounded.trim()));
        }
        String size = System.getProperty(HEAP_ELEM_SIZE_PROPERTY);
        if (size != null) {
            try {
                b.setHeapElemSize(Integer.parseInt(size.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    HEAP_ELEM_SIZE_PROPERTY + " is not a number: " + size, e);
            }
        }
        return b.build();
    }

    public boolean isBounded() {
        return opts.getBounded();
    }

    /**
     * Width in bits of a generated heap element.
     */
    public int getHeapElemSize() {
        return opts.getHeapElemSize();
    }

    /**
     * Return an integer of the run's mode.
     * @param width the width used in bounded mode
     * @param value the signed value
     */
    public IntValue intOf(long width, BigInteger value) {
        if (isBounded()) {
            return new BitvectorValue(width, value);
        }
        return new IntegerValue(value);
    }

    public IntValue intOf(long width, long value) {
        return intOf(width, BigInteger.valueOf(value));
    }

    /** The null address: 64 zero bits, or unbounded zero. */
    public IntValue zeroAddress() {
        return intOf(64, 0);
    }

    /** The value of a heap cell that was never written. */
    public IntValue zeroCell() {
        return intOf(8, 0);
    }

    public Protos.RunOptions getRep() {
        return opts;
    }

    public String toString() {
        return (isBounded() ? "bounded" : "unbounded") + ", heap element size " + getHeapElemSize();
    }

    public boolean equals(Object o) {
        if (!(o instanceof RunConfig)) return false;
        return opts.equals(((RunConfig) o).opts);
    }

    public int hashCode() {
        return opts.hashCode();
    }

    public static final class Builder {
        private final Protos.RunOptions.Builder opts;

        private Builder() {
            opts = Protos.RunOptions.newBuilder();
            opts.setBounded(false);
            opts.setHeapElemSize(DEFAULT_HEAP_ELEM_SIZE);
        }

        public Builder setBounded(boolean b) {
            opts.setBounded(b);
            return this;
        }

        /**
         * Set the width in bits of a generated heap element.  Must be a
         * positive multiple of eight.
         */
        public Builder setHeapElemSize(int bits) {
            if (bits <= 0 || bits % 8 != 0) {
                throw new IllegalArgumentException(
                    "Heap element size must be a positive multiple of 8: " + bits);
            }
            opts.setHeapElemSize(bits);
            return this;
        }

        public RunConfig build() {
            return new RunConfig(opts.build());
        }
    }
}
