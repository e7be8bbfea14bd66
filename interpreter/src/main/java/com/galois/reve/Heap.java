package com.galois.reve;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Memory of an interpreted program, keyed by address.
 *
 * <p>
 * In bounded mode every cell holds one byte and multi-byte values are spread
 * over consecutive addresses, most significant byte first.  In unbounded mode
 * a cell holds a whole value.  Reading an address that was never written
 * inserts a zero cell, so the read shows up in later snapshots.  Cells are
 * never removed.
 */
public final class Heap {
    private final RunConfig config;
    private final TreeMap<IntValue,IntValue> contents;

    public Heap(RunConfig config) {
        if (config == null) throw new NullPointerException("config");
        this.config = config;
        this.contents = new TreeMap<IntValue,IntValue>();
    }

    /**
     * Create a heap from existing cells.  In bounded mode every cell must be
     * a byte at a 64-bit address.
     */
    public Heap(RunConfig config, SortedMap<IntValue,IntValue> cells) {
        this(config);
        for (SortedMap.Entry<IntValue,IntValue> e : cells.entrySet()) {
            put(e.getKey(), e.getValue());
        }
    }

    /**
     * Return an independent copy of <code>h</code>.
     */
    public static Heap copyOf(Heap h) {
        return new Heap(h.config, h.contents);
    }

    public RunConfig getConfig() {
        return config;
    }

    /**
     * Set the cell at <code>address</code> directly.
     */
    public void put(IntValue address, IntValue cell) {
        if (address == null) throw new NullPointerException("address");
        if (cell == null) throw new NullPointerException("cell");
        checkMode(address);
        checkMode(cell);
        if (config.isBounded()) {
            BitvectorValue b = (BitvectorValue) cell;
            if (b.getWidth() != 8) {
                throw new InterpreterFailedException("Heap cells are bytes in bounded mode: " + cell);
            }
        }
        contents.put(address.asPointer(), cell);
    }

    /**
     * Read a value of <code>width</code> bits at <code>address</code>.
     *
     * @param address the address
     * @param width the width of the value, a multiple of 8 in bounded mode;
     *   ignored in unbounded mode
     * @return the value
     */
    public IntValue load(IntValue address, long width) {
        checkMode(address);
        IntValue base = address.asPointer();
        if (!config.isBounded()) {
            return cell(base);
        }
        int bytes = byteCount(width);
        BitvectorValue val = new BitvectorValue(width, 0);
        IntValue eight = new BitvectorValue(width, 8);
        for (int i = 0; i < bytes; ++i) {
            IntValue b = cell(base.add(new BitvectorValue(64, i)));
            val = (BitvectorValue) val.shl(eight).or(b.zext(width));
        }
        return val;
    }

    /**
     * Write <code>value</code> at <code>address</code>.
     */
    public void store(IntValue address, IntValue value) {
        checkMode(address);
        checkMode(value);
        IntValue base = address.asPointer();
        if (!config.isBounded()) {
            contents.put(base, value);
            return;
        }
        BitvectorValue bits = (BitvectorValue) value;
        int bytes = byteCount(bits.getWidth());
        for (int i = 0; i < bytes; ++i) {
            int shift = 8 * (bytes - 1 - i);
            BitvectorValue b = new BitvectorValue(8, bits.getValue().shiftRight(shift));
            contents.put(base.add(new BitvectorValue(64, i)), b);
        }
    }

    // Return the cell at address, inserting a zero cell if it is absent.
    private IntValue cell(IntValue address) {
        IntValue c = contents.get(address);
        if (c == null) {
            c = config.zeroCell();
            contents.put(address, c);
        }
        return c;
    }

    private static int byteCount(long width) {
        if (width <= 0 || width % 8 != 0) {
            throw new UnsupportedConstructException(
                "Heap accesses in bounded mode must be a whole number of bytes: " + width + " bits");
        }
        return (int) (width / 8);
    }

    private void checkMode(IntValue v) {
        if (v.isBounded() != config.isBounded()) {
            throw new InterpreterFailedException(
                String.format("%s integer %s used with a %s heap",
                              v.isBounded() ? "Bounded" : "Unbounded", v,
                              config.isBounded() ? "bounded" : "unbounded"));
        }
    }

    /**
     * Return the number of cells.
     */
    public int size() {
        return contents.size();
    }

    /**
     * Return a read-only view of the cells.
     */
    public SortedMap<IntValue,IntValue> cells() {
        return Collections.unmodifiableSortedMap(contents);
    }

    /**
     * Return an immutable copy of the current cells.
     */
    public SortedMap<IntValue,IntValue> snapshot() {
        return Collections.unmodifiableSortedMap(new TreeMap<IntValue,IntValue>(contents));
    }

    public String toString() {
        return "Heap " + contents.toString();
    }
}
