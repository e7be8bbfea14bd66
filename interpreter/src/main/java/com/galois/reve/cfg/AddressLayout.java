package com.galois.reve.cfg;

import java.util.List;

import com.galois.reve.IntValue;
import com.galois.reve.RunConfig;

/**
 * Computes the address of an element from a base address and indices.  The
 * layout of the addressed type is known to whoever builds the graph, so the
 * interpreter treats it as an opaque function.
 */
public interface AddressLayout {
    /**
     * Return the address of the element.
     * @param config the run configuration, giving the integer mode
     * @param base the base address
     * @param indices the index values, in order
     * @return the element address
     */
    IntValue address(RunConfig config, IntValue base, List<IntValue> indices);
}
