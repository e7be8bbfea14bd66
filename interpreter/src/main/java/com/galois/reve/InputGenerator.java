package com.galois.reve;

import java.math.BigInteger;
import java.util.Random;

import com.galois.reve.cfg.FunctionArg;
import com.galois.reve.cfg.Procedure;

/**
 * Creates random entry environments for a procedure.
 *
 * <p>
 * Integers are drawn uniformly from an inclusive range and then wrapped to
 * their width in bounded mode.  Generated heap elements are
 * {@link RunConfig#getHeapElemSize()} bits wide.
 */
public final class InputGenerator {
    private final RunConfig config;
    private final Random random;
    private final BigInteger lower;
    private final BigInteger range;

    /**
     * @param config the run configuration
     * @param random the source of randomness
     * @param lower the smallest generated integer
     * @param upper the largest generated integer
     */
    public InputGenerator(RunConfig config, Random random, long lower, long upper) {
        if (config == null) throw new NullPointerException("config");
        if (random == null) throw new NullPointerException("random");
        if (lower > upper) {
            String msg = String.format("Empty range [%d, %d]", lower, upper);
            throw new IllegalArgumentException(msg);
        }
        this.config = config;
        this.random = random;
        this.lower = BigInteger.valueOf(lower);
        this.range = BigInteger.valueOf(upper).subtract(this.lower).add(BigInteger.ONE);
    }

    private BigInteger randomInteger() {
        BigInteger r;
        do {
            r = new BigInteger(range.bitLength(), random);
        } while (r.compareTo(range) >= 0);
        return lower.add(r);
    }

    /**
     * Return a random value of type <code>t</code>.
     */
    public TypedValue randomValue(Type t) {
        if (t.isBool()) {
            return TypedValue.of(random.nextBoolean());
        }
        if (!t.isIntLike()) {
            throw new IllegalArgumentException("Cannot generate a value of type " + t);
        }
        return TypedValue.of(config.intOf(t.getWidth(), randomInteger()));
    }

    /**
     * Return an environment binding every argument of <code>fun</code> to a
     * random value.
     */
    public Environment randomEnvironment(Procedure fun, Heap heap) {
        Environment env = new Environment(heap);
        for (FunctionArg a : fun.getArgs()) {
            env.bind(a, randomValue(a.type()));
        }
        return env;
    }

    /**
     * Return a heap holding <code>count</code> consecutive random elements
     * starting at <code>base</code>.  In bounded mode each element occupies
     * <code>heapElemSize / 8</code> addresses; in unbounded mode one.
     */
    public Heap randomHeap(long base, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        Heap heap = new Heap(config);
        int width = config.getHeapElemSize();
        long stride = config.isBounded() ? width / 8 : 1;
        for (int i = 0; i != count; ++i) {
            IntValue addr = config.intOf(64, base + i * stride);
            heap.store(addr, config.intOf(width, randomInteger()));
        }
        return heap;
    }
}
